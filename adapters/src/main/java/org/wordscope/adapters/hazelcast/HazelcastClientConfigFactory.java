package org.wordscope.adapters.hazelcast;

import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.client.config.ClientConnectionStrategyConfig;

/**
 * Builds Hazelcast {@link ClientConfig} for processes that use an external cache cluster.
 *
 * <p>A client does not bind the member port; it connects to the explicit address list derived from
 * the configured members.</p>
 */
public final class HazelcastClientConfigFactory {
	private HazelcastClientConfigFactory() {}

	public static ClientConfig build(HazelcastSettings settings) {
		ClientConfig config = new ClientConfig();
		config.setProperty("hazelcast.logging.type", "slf4j");
		config.setClusterName(settings.clusterName());

		long timeoutSeconds = Math.max(1, settings.operationTimeoutMs() / 1000);
		config.setProperty("hazelcast.client.invocation.timeout.seconds", String.valueOf(timeoutSeconds));
		// Fail fast instead of blocking callers while the cluster is away
		config.getConnectionStrategyConfig()
				.setAsyncStart(true)
				.setReconnectMode(ClientConnectionStrategyConfig.ReconnectMode.ASYNC);

		var network = config.getNetworkConfig();
		network.getAddresses().clear();
		HazelcastConfigFactory.memberAddresses(settings).forEach(network::addAddress);
		network.setConnectionTimeout((int) Math.min(Integer.MAX_VALUE, settings.operationTimeoutMs()));
		return config;
	}
}
