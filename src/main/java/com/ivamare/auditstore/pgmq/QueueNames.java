package com.ivamare.auditstore.pgmq;

/**
 * Queue naming utilities.
 *
 * <p>Queue names follow the pattern {destination}__{suffix}, where the
 * destination is the table a queued write targets.
 */
public final class QueueNames {

    private QueueNames() {
    }

    /** Suffix for dead letter queues holding failed writes */
    public static final String DLQ_SUFFIX = "dlq";

    /** Separator between destination and suffix */
    public static final String SEPARATOR = "__";

    /**
     * @param destination target table of the queued writes
     * @return queue name in format {destination}__dlq
     */
    public static String dlqQueue(String destination) {
        return destination + SEPARATOR + DLQ_SUFFIX;
    }

    /**
     * Extract the destination from a queue name.
     *
     * @param queueName the queue name
     * @return the destination part, or the queue name itself if no separator is found
     */
    public static String extractDestination(String queueName) {
        int separatorIndex = queueName.indexOf(SEPARATOR);
        return separatorIndex > 0 ? queueName.substring(0, separatorIndex) : queueName;
    }

    /**
     * @return live message table, in format pgmq.q_{queueName}
     */
    public static String queueTable(String queueName) {
        return "pgmq.q_" + queueName;
    }

    /**
     * @return archive table, in format pgmq.a_{queueName}
     */
    public static String archiveTable(String queueName) {
        return "pgmq.a_" + queueName;
    }
}
