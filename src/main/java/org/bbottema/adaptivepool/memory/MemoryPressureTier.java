package org.bbottema.adaptivepool.memory;

public enum MemoryPressureTier {
	LOW, MEDIUM, HIGH, CRITICAL
}
