package org.wordscope.adapters.hazelcast;

import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.config.Config;
import com.hazelcast.config.EvictionPolicy;
import com.hazelcast.config.MapConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HazelcastConfigFactoryTest {

	private static HazelcastSettings settings(String mode, List<String> members, List<Integer> ports) {
		return new HazelcastSettings(mode, "wordscope", "127.0.0.1", 5701, members, ports,
				"wordscope-cache", 1, 50_000, 3_000);
	}

	@Test
	public void testMemberConfigUsesTcpIpJoinOnly() {
		Config config = HazelcastConfigFactory.build(settings("member", List.of("10.0.0.1", "10.0.0.2:5800"), List.of()));

		var join = config.getNetworkConfig().getJoin();
		assertFalse(join.getMulticastConfig().isEnabled());
		assertTrue(join.getTcpIpConfig().isEnabled());
		assertEquals(List.of("10.0.0.1:5701", "10.0.0.2:5800"), join.getTcpIpConfig().getMembers());
		assertEquals("wordscope", config.getClusterName());
		assertEquals(5701, config.getNetworkConfig().getPort());
	}

	@Test
	public void testBareMembersExpandedWithMemberPorts() {
		HazelcastSettings s = settings("member", List.of("10.0.0.1"), List.of(5701, 5702));

		assertEquals(List.of("10.0.0.1:5701", "10.0.0.1:5702"), List.copyOf(HazelcastConfigFactory.memberAddresses(s)));
	}

	@Test
	public void testCacheMapIsLruBounded() {
		Config config = HazelcastConfigFactory.build(settings("member", List.of("127.0.0.1"), List.of()));

		MapConfig mapConfig = config.getMapConfig("wordscope-cache");
		assertEquals(EvictionPolicy.LRU, mapConfig.getEvictionConfig().getEvictionPolicy());
		assertEquals(50_000, mapConfig.getEvictionConfig().getSize());
		assertEquals(1, mapConfig.getBackupCount());
	}

	@Test
	public void testClientConfigListsAddresses() {
		ClientConfig config = HazelcastClientConfigFactory.build(settings("client", List.of("10.0.0.1", "10.0.0.2"), List.of()));

		assertEquals("wordscope", config.getClusterName());
		assertEquals(List.of("10.0.0.1:5701", "10.0.0.2:5701"), config.getNetworkConfig().getAddresses());
		assertEquals("3", config.getProperty("hazelcast.client.invocation.timeout.seconds"));
	}

	@Test
	public void testLoopbackIsLocalInterface() {
		assertTrue(HazelcastConfigFactory.isLocalInterfaceAddress("127.0.0.1"));
		assertFalse(HazelcastConfigFactory.isLocalInterfaceAddress(" "));
	}

	@Test
	public void testUnknownModeRejected() {
		assertThrows(IllegalArgumentException.class, () -> settings("sidecar", List.of(), List.of()));
	}
}
