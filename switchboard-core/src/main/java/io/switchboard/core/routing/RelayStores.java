package io.switchboard.core.routing;

import io.switchboard.core.conversation.ConversationStore;
import io.switchboard.core.memory.MemoryStore;
import io.switchboard.core.owner.OwnerStore;
import io.switchboard.core.transcript.TranscriptStore;

public record RelayStores(
    OwnerStore owners,
    ConversationStore conversations,
    TranscriptStore transcripts,
    MemoryStore memories
) {
}
