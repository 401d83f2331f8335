/**
 * Queue configuration.
 *
 * <p>Configuration lives in JSON5 files parsed with Gson into maps.
 * <br>{@link com.nestack.mailqueue.config.BasicConfig} provides typed accessors with dotted sub-keys.
 * <br>{@link com.nestack.mailqueue.config.QueueConfig} exposes rate limits, retry policy and cron settings.
 *
 * <h2>Example queue.json5:</h2>
 * <pre>
 * {
 *   hourlyLimit: 100,
 *   dailyLimit: 1000,
 *   maxAttempts: 3,
 *   retryDelayMs: 5000,
 *   sendIntervalMs: 100,
 *   cron: { enabled: true, initialDelaySeconds: 10, intervalSeconds: 30, maxPerTick: 10 }
 * }
 * </pre>
 */
package com.nestack.mailqueue.config;
