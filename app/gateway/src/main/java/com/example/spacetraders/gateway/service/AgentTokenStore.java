/*
 * どこで: Gateway サービス層
 * 何を: エージェントシンボル -> Bearer トークンの対応を JSON ファイルへ永続化する
 * なぜ: 登録で発行されたトークンを再起動後も使い続けるため
 */
package com.example.spacetraders.gateway.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AgentTokenStore {

  private static final Logger logger = LoggerFactory.getLogger(AgentTokenStore.class);
  private static final TypeReference<LinkedHashMap<String, String>> TOKEN_MAP_TYPE =
      new TypeReference<>() {};

  private final Path file;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, String> tokens = new LinkedHashMap<>();

  public AgentTokenStore(Path file, ObjectMapper objectMapper) {
    if (file == null) {
      throw new IllegalArgumentException("file is required");
    }
    this.file = file;
    this.objectMapper = objectMapper;
  }

  /**
   * Replaces the in-memory mapping with the file contents. A missing file yields an empty map; an
   * unreadable file leaves the current mapping untouched.
   */
  public void load() {
    lock.writeLock().lock();
    try {
      if (!Files.exists(file)) {
        tokens.clear();
        logger.info("agent token file not found, starting empty path={}", file);
        return;
      }
      final Map<String, String> loaded = read();
      tokens.clear();
      tokens.putAll(loaded);
      logger.info("agent tokens loaded path={} count={}", file, tokens.size());
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<String> get(String agentSymbol) {
    if (agentSymbol == null) {
      return Optional.empty();
    }
    lock.readLock().lock();
    try {
      return Optional.ofNullable(tokens.get(agentSymbol));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Inserts or overwrites the token, then persists the whole mapping before returning. */
  public void store(String agentSymbol, String token) {
    if (agentSymbol == null || agentSymbol.isBlank()) {
      throw new IllegalArgumentException("agentSymbol is required");
    }
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token is required");
    }
    lock.writeLock().lock();
    try {
      final String previous = tokens.put(agentSymbol, token);
      try {
        write(tokens);
      } catch (TokenStorageException ex) {
        // ディスクとメモリを一致させるため書き込み前の状態へ戻す。
        if (previous == null) {
          tokens.remove(agentSymbol);
        } else {
          tokens.put(agentSymbol, previous);
        }
        throw ex;
      }
      logger.info(
          "agent token stored agentSymbol={} replaced={} count={}",
          agentSymbol,
          previous != null,
          tokens.size());
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Map<String, String> snapshot() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Path file() {
    return file;
  }

  private Map<String, String> read() {
    final Map<String, String> loaded;
    try {
      loaded = objectMapper.readValue(file.toFile(), TOKEN_MAP_TYPE);
    } catch (IOException ex) {
      logger.error("agent token file is unreadable or malformed path={}", file, ex);
      throw new TokenStorageException(file, "agent token file is unreadable or malformed", ex);
    }
    if (loaded == null) {
      throw new TokenStorageException(file, "agent token file is not a JSON object", null);
    }
    for (Map.Entry<String, String> entry : loaded.entrySet()) {
      if (entry.getValue() == null) {
        throw new TokenStorageException(
            file, "agent token file has no token for " + entry.getKey(), null);
      }
    }
    return loaded;
  }

  private void write(Map<String, String> current) {
    final Path absolute = file.toAbsolutePath();
    final Path directory = absolute.getParent();
    Path temp = null;
    try {
      if (directory != null) {
        Files.createDirectories(directory);
      }
      temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), current);
      moveIntoPlace(temp, absolute);
    } catch (IOException ex) {
      deleteQuietly(temp);
      logger.error("failed to persist agent tokens path={}", file, ex);
      throw new TokenStorageException(file, "failed to persist agent tokens", ex);
    }
  }

  private void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      logger.debug("atomic move not supported, falling back to replace path={}", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanupEx) {
      logger.warn("failed to delete temporary token file path={}", temp, cleanupEx);
    }
  }
}
