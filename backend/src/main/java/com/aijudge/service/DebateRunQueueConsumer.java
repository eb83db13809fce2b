package com.aijudge.service;

import java.util.UUID;

@FunctionalInterface
public interface DebateRunQueueConsumer {

    void accept(UUID debateId);
}
