package com.flagship.hospital_cash.topic;

/**
 * Vocabulary of the application's publish/subscribe channels.
 *
 * Each channel maps to one Kafka topic, named by prefixing the channel key
 * with the configured {@code topic.prefix}.
 */
public final class Topic {

    private Topic() {
        // Vocabulary only
    }

    public enum Channel {
        FINANCE("finance"),
        INVENTORY("inventory");

        private final String key;

        Channel(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }

        public String topicName(String prefix) {
            return (prefix == null ? "" : prefix) + key;
        }
    }

    public enum Event {
        CREATE,
        UPDATE,
        DELETE,
        REVERSE
    }

    public enum Entity {
        PAYMENT,
        INVOICE,
        VOUCHER,
        PATIENT
    }
}
