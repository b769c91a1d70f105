package com.signalengine.job;

/** Reference to an enqueued job. */
public record JobHandle(String jobId, String queueName) {}
