package com.llmcommittee.provider;

import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for {@code data:} lines of a server-sent-events body. Text may arrive split
 * at any position; an unterminated trailing line is held until the next chunk or {@link #finish()}.
 */
public final class SseDataDecoder {

    private static final String DATA_PREFIX = "data:";

    private final StringBuilder pending = new StringBuilder();

    public List<String> feed(char[] chunk, int offset, int length) {
        pending.append(chunk, offset, length);
        return drainCompleteLines();
    }

    public List<String> feed(String chunk) {
        pending.append(chunk);
        return drainCompleteLines();
    }

    public List<String> finish() {
        List<String> payloads = new ArrayList<>();
        if (pending.length() > 0) {
            addPayload(pending.toString(), payloads);
            pending.setLength(0);
        }
        return payloads;
    }

    private List<String> drainCompleteLines() {
        List<String> payloads = new ArrayList<>();
        int lineStart = 0;
        for (int i = 0; i < pending.length(); i++) {
            if (pending.charAt(i) == '\n') {
                addPayload(pending.substring(lineStart, i), payloads);
                lineStart = i + 1;
            }
        }
        pending.delete(0, lineStart);
        return payloads;
    }

    private static void addPayload(String line, List<String> payloads) {
        String trimmed = line.trim();
        if (!trimmed.startsWith(DATA_PREFIX)) {
            return;
        }
        String payload = trimmed.substring(DATA_PREFIX.length()).trim();
        if (!payload.isEmpty()) {
            payloads.add(payload);
        }
    }
}
