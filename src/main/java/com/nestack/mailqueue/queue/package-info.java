/**
 * In-memory outbound email queue with sliding window rate limiting.
 *
 * <p>The {@link com.nestack.mailqueue.queue.EmailQueue} holds emails not yet delivered, ordered by priority
 * <br>then enqueue time, and releases them one at a time through {@link com.nestack.mailqueue.queue.EmailQueue#dequeue()}.
 *
 * <p>The {@link com.nestack.mailqueue.queue.SendHistory} ledger records completed sends and answers whether
 * <br>another send fits the hourly and daily limits. Dequeue consults it before touching the queue.
 *
 * <h2>Delivery loop:</h2>
 * <ol>
 *     <li>Producer calls {@code enqueue} and keeps the returned id for correlation.</li>
 *     <li>Worker calls {@code dequeue}; null means rate limited or nothing due.</li>
 *     <li>On transport success the worker calls {@code recordSent}.</li>
 *     <li>On failure it calls {@code requeueForRetry}, which reschedules or drops the email.</li>
 * </ol>
 *
 * <p>Nothing here is persisted. Contents are lost on restart.
 *
 * @see com.nestack.mailqueue.delivery.EmailQueueProcessor
 */
package com.nestack.mailqueue.queue;
