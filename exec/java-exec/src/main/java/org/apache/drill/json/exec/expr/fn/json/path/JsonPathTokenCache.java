/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.drill.json.exec.expr.fn.json.path;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

/**
 * Bounded map from path text to its tokens. Owned by a single function
 * call and never shared between threads. When full, the least recently
 * used path is evicted. Output never depends on the cache: a capacity
 * of zero simply re-tokenizes every path.
 */
public class JsonPathTokenCache {
  private static final Logger logger = LoggerFactory.getLogger(JsonPathTokenCache.class);

  public static final int DEFAULT_CAPACITY = 32;

  private final Cache<String, List<JsonPathToken>> cache;
  private final int capacity;

  public JsonPathTokenCache() {
    this(DEFAULT_CAPACITY);
  }

  public JsonPathTokenCache(int capacity) {
    Preconditions.checkArgument(capacity >= 0, "capacity must not be negative: %s", capacity);
    this.capacity = capacity;

    // One segment so that eviction follows access order across all keys.
    this.cache = CacheBuilder.newBuilder()
        .concurrencyLevel(1)
        .maximumSize(capacity)
        .recordStats()
        .build();
  }

  /**
   * Returns the tokens for a path, tokenizing it on a miss. A path that
   * fails to tokenize is not cached.
   *
   * @param path the path text
   * @return the immutable token list
   * @throws InvalidJsonPathException if the path is malformed
   */
  public List<JsonPathToken> resolve(String path) {
    Preconditions.checkNotNull(path);
    List<JsonPathToken> tokens = cache.getIfPresent(path);
    if (tokens != null) {
      return tokens;
    }
    tokens = JsonPathTokenizer.tokenize(path);
    if (capacity > 0) {
      cache.put(path, tokens);
      logger.trace("Cached tokens for JSON path {}: {}", path, tokens);
    }
    return tokens;
  }

  public int capacity() { return capacity; }

  public long size() { return cache.size(); }

  public CacheStats stats() { return cache.stats(); }

  public void clear() { cache.invalidateAll(); }
}
