package org.bbottema.adaptivepool;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates cluster-unique instance ids of the form {@code {hostname}_{random}_{pid}}.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class InstanceIdGenerator {

	@NotNull
	static String generate() {
		return hostname() + "_" + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000000, 0x10000000)) + "_" + pid();
	}

	@NotNull
	static String hostname() {
		try {
			return InetAddress.getLocalHost().getHostName();
		} catch (UnknownHostException e) {
			log.warn("Could not resolve local hostname, using 'localhost' in the instance id: {}", e.getMessage());
			return "localhost";
		}
	}

	static long pid() {
		return ProcessHandle.current().pid();
	}
}
