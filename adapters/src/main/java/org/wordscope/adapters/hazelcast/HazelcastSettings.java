package org.wordscope.adapters.hazelcast;

import java.util.List;

/**
 * Connection and map settings shared by the member and client config factories.
 *
 * @param mode           {@code member} starts an embedded member, {@code client} joins an existing cluster
 * @param members        cluster addresses, either {@code ip} or {@code ip:port}
 * @param memberPorts    ports to expand bare member IPs with; falls back to {@code port} when empty
 * @param maxEntries     per-node LRU bound on the cache map
 */
public record HazelcastSettings(
		String mode,
		String clusterName,
		String currentNodeIp,
		int port,
		List<String> members,
		List<Integer> memberPorts,
		String cacheMapName,
		int backupCount,
		int maxEntries,
		long operationTimeoutMs
) {
	public static final String MODE_MEMBER = "member";
	public static final String MODE_CLIENT = "client";

	public HazelcastSettings {
		members = members == null ? List.of() : List.copyOf(members);
		memberPorts = memberPorts == null ? List.of() : List.copyOf(memberPorts);
		if (!MODE_MEMBER.equals(mode) && !MODE_CLIENT.equals(mode)) {
			throw new IllegalArgumentException("Unknown hazelcast mode: " + mode);
		}
	}

	public boolean clientMode() {
		return MODE_CLIENT.equals(mode);
	}
}
