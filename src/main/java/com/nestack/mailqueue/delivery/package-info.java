/**
 * Delivery side of the email queue.
 *
 * <p>The {@link com.nestack.mailqueue.delivery.EmailSender} is the transport seam; implementations
 * <br>wrap SMTP or provider APIs and live outside this library.
 *
 * <ul>
 *     <li>{@link com.nestack.mailqueue.delivery.EmailQueueProcessor} drains the queue and books outcomes.</li>
 *     <li>{@link com.nestack.mailqueue.delivery.EmailQueueCron} runs the processor on a schedule.</li>
 *     <li>{@link com.nestack.mailqueue.delivery.EmailDispatcher} sends immediately or queues when rate limited.</li>
 * </ul>
 */
package com.nestack.mailqueue.delivery;
