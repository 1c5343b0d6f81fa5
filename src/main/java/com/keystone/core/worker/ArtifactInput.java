package com.keystone.core.worker;

/**
 * A consumable artifact handed to a worker.
 */
public record ArtifactInput(String name, int version, String producingStep, String content) {}
