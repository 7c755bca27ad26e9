package com.convsync.log;

import com.convsync.domain.StreamEntryId;

public record LogEntry(StreamEntryId id, String payload, long producedAt) {
}
