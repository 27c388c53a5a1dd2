package com.example.spacetraders.gateway.model;

/**
 * Which bearer token a dispatched request carries.
 *
 * <p>{@link Agent} falls back to an unauthenticated request when no token is stored for the
 * symbol, so public endpoints can be reached through the same path.
 */
public sealed interface CredentialSelection
    permits CredentialSelection.Account, CredentialSelection.Agent, CredentialSelection.None {

  static CredentialSelection account() {
    return Account.INSTANCE;
  }

  static CredentialSelection agent(String agentSymbol) {
    return new Agent(agentSymbol);
  }

  static CredentialSelection none() {
    return None.INSTANCE;
  }

  final class Account implements CredentialSelection {
    private static final Account INSTANCE = new Account();

    private Account() {}

    @Override
    public String toString() {
      return "Account";
    }
  }

  record Agent(String agentSymbol) implements CredentialSelection {
    public Agent {
      if (agentSymbol == null || agentSymbol.isBlank()) {
        throw new IllegalArgumentException("agentSymbol is required");
      }
    }
  }

  final class None implements CredentialSelection {
    private static final None INSTANCE = new None();

    private None() {}

    @Override
    public String toString() {
      return "None";
    }
  }
}
