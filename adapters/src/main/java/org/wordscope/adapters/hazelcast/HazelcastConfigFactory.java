package org.wordscope.adapters.hazelcast;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.hazelcast.config.Config;
import com.hazelcast.config.EvictionPolicy;
import com.hazelcast.config.MapConfig;
import com.hazelcast.config.MaxSizePolicy;

/**
 * Builds the Hazelcast member {@link Config} used when the cache runs embedded in the API process.
 *
 * <p>Uses TCP-IP discovery with a fixed member list and disables multicast/auto-detection.</p>
 */
public final class HazelcastConfigFactory {
	private HazelcastConfigFactory() {}

	/**
	 * Creates a member configuration based on the provided settings.
	 *
	 * @param settings cluster name, member list, cache map name and limits
	 * @return the Hazelcast {@link Config}
	 */
	public static Config build(HazelcastSettings settings) {
		Config config = new Config();
		config.setProperty("hazelcast.logging.type", "slf4j");
		config.setProperty("hazelcast.operation.call.timeout.millis", String.valueOf(settings.operationTimeoutMs()));
		config.setClusterName(settings.clusterName());
		configureNetwork(config, settings);
		configureCacheMap(config, settings);
		return config;
	}

	private static void configureNetwork(Config config, HazelcastSettings s) {
		config.getNetworkConfig().setPort(s.port()).setPortAutoIncrement(false);

		// Interface matching only works when the advertised IP is bound locally (not the case inside containers)
		if (isLocalInterfaceAddress(s.currentNodeIp())) {
			config.getNetworkConfig().getInterfaces().setEnabled(true).addInterface(s.currentNodeIp());
		} else {
			config.getNetworkConfig().getInterfaces().setEnabled(false);
		}

		if (s.currentNodeIp() != null && !s.currentNodeIp().isBlank()) {
			config.getNetworkConfig().setPublicAddress(s.currentNodeIp().trim() + ":" + s.port());
		}
		configureJoin(config, s);
	}

	static boolean isLocalInterfaceAddress(String ip) {
		if (ip == null || ip.isBlank()) {
			return false;
		}
		String trimmed = ip.trim();
		if ("localhost".equalsIgnoreCase(trimmed) || "127.0.0.1".equals(trimmed)) {
			return true;
		}

		try {
			InetAddress target = InetAddress.getByName(trimmed);
			Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
			if (interfaces == null) {
				return false;
			}
			while (interfaces.hasMoreElements()) {
				Enumeration<InetAddress> addresses = interfaces.nextElement().getInetAddresses();
				while (addresses.hasMoreElements()) {
					if (addresses.nextElement().equals(target)) {
						return true;
					}
				}
			}
			return false;
		} catch (UnknownHostException | SocketException | SecurityException e) {
			return false;
		}
	}

	private static void configureJoin(Config config, HazelcastSettings s) {
		var join = config.getNetworkConfig().getJoin();
		join.getMulticastConfig().setEnabled(false);
		join.getAutoDetectionConfig().setEnabled(false);

		var tcpIp = join.getTcpIpConfig();
		tcpIp.setEnabled(true);
		tcpIp.getMembers().clear();
		memberAddresses(s).forEach(tcpIp::addMember);
	}

	/**
	 * Member list with bare IPs expanded to {@code ip:port} for every configured member port
	 */
	static Set<String> memberAddresses(HazelcastSettings s) {
		Set<String> expanded = new LinkedHashSet<>();
		for (String member : s.members()) {
			expanded.addAll(expand(member, s.memberPorts(), s.port()));
		}
		return expanded;
	}

	private static List<String> expand(String member, List<Integer> memberPorts, int defaultPort) {
		if (member == null || member.isBlank()) {
			return List.of();
		}
		String trimmed = member.trim();
		if (trimmed.contains(":")) {
			return List.of(trimmed);
		}
		if (!memberPorts.isEmpty()) {
			return memberPorts.stream().map(p -> trimmed + ":" + p).toList();
		}
		return List.of(trimmed + ":" + defaultPort);
	}

	private static void configureCacheMap(Config config, HazelcastSettings s) {
		MapConfig cacheCfg = new MapConfig(s.cacheMapName())
				.setBackupCount(s.backupCount());
		cacheCfg.getEvictionConfig()
				.setEvictionPolicy(EvictionPolicy.LRU)
				.setMaxSizePolicy(MaxSizePolicy.PER_NODE)
				.setSize(s.maxEntries());
		config.addMapConfig(cacheCfg);
	}
}
