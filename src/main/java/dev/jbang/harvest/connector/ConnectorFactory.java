package dev.jbang.harvest.connector;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/** Factory for creating connector instances using ServiceLoader */
public class ConnectorFactory {

	/** Create a connector by name */
	public static Connector createConnector(String connectorName, ConnectorConfig config) {
		return discovery(connectorName).create(config);
	}

	/** Find the discovery registered under the given name */
	public static Connector.Discovery discovery(String connectorName) {
		Connector.Discovery discovery = getAvailableConnectorDiscoveries().get(connectorName);
		if (discovery == null) {
			throw new IllegalArgumentException("Unknown connector: " + connectorName);
		}
		return discovery;
	}

	/** Get all available connector discoveries, sorted by name */
	public static Map<String, Connector.Discovery> getAvailableConnectorDiscoveries() {
		Map<String, Connector.Discovery> discs = new TreeMap<>();

		ServiceLoader<Connector.Discovery> loader = ServiceLoader.load(Connector.Discovery.class);
		for (Connector.Discovery discovery : loader) {
			discs.put(discovery.name(), discovery);
		}

		return discs;
	}
}
