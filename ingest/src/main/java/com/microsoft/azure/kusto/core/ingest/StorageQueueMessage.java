package com.microsoft.azure.kusto.core.ingest;

import org.jetbrains.annotations.Nullable;

/**
 * A message read from a storage queue.
 */
public class StorageQueueMessage {
    private final String messageId;
    private final String popReceipt;
    private final String messageText;

    public StorageQueueMessage(String messageId, @Nullable String popReceipt, String messageText) {
        this.messageId = messageId;
        this.popReceipt = popReceipt;
        this.messageText = messageText;
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * @return the receipt needed to delete the message, null when the message was only peeked
     */
    @Nullable
    public String getPopReceipt() {
        return popReceipt;
    }

    public String getMessageText() {
        return messageText;
    }
}
