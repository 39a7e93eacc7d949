package io.agentmesh.server.events;

import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;

/**
 * Inbound handler behind an agent's mailbox.
 */
@FunctionalInterface
public interface MailboxHandler {

    /**
     * @param sender the sending agent name
     * @param message the delivered message
     * @return an optional reply, handed back to the sender
     */
    @Nullable Message onMessage(String sender, Message message) throws Exception;
}
