package com.ivamare.auditstore.pgmq;

import com.ivamare.auditstore.model.PgmqMessage;

import java.util.List;
import java.util.Map;

/**
 * Client for interacting with PGMQ queues.
 *
 * <p>Wraps PGMQ SQL functions for queue operations. All methods participate
 * in a surrounding transaction when one is active.
 */
public interface PgmqClient {

    /**
     * Create a queue if it doesn't exist.
     *
     * @param queueName Name of the queue to create
     */
    void createQueue(String queueName);

    /**
     * Send a message to a queue.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Map<String, Object> message);

    /**
     * Send a message to a queue with delay.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @param delaySeconds Delay in seconds before message becomes visible
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Map<String, Object> message, int delaySeconds);

    /**
     * Read messages, hiding them from other readers for the visibility timeout.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Lease length in seconds
     * @param batchSize Maximum number of messages to return
     * @return Leased messages, possibly empty
     */
    List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int batchSize);

    /**
     * Delete a message.
     *
     * @return true if the message existed
     */
    boolean delete(String queueName, long msgId);

    /**
     * Move a message to the queue's archive table.
     *
     * @return true if the message existed
     */
    boolean archive(String queueName, long msgId);

    /**
     * Set when a message becomes visible again.
     *
     * @return true if the message existed
     */
    boolean setVisibilityTimeout(String queueName, long msgId, int visibilityTimeoutSeconds);

    /**
     * Replace the payload of a message in place.
     *
     * @return true if the message existed
     */
    boolean updateMessage(String queueName, long msgId, Map<String, Object> message);

    /**
     * @return number of messages currently in the queue, visible or not
     */
    long queueLength(String queueName);

    /**
     * Most recently archived messages.
     *
     * @param queueName Name of the queue
     * @param limit Maximum number of messages
     * @return Archived messages, newest first
     */
    List<PgmqMessage> readArchive(String queueName, int limit);
}
