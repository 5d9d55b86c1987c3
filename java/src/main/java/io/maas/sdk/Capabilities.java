package io.maas.sdk;

/**
 * Capability strings advertised by MAAS in its version document. Resource code consults
 * {@link BoundClient#hasCapability(String)} before relying on the matching feature.
 */
public final class Capabilities {

    public static final String NETWORKS_MANAGEMENT = "networks-management";
    public static final String STATIC_IP_ADDRESSES = "static-ipaddresses";
    public static final String IPV6_DEPLOYMENT_UBUNTU = "ipv6-deployment-ubuntu";
    public static final String DEVICES_MANAGEMENT = "devices-management";
    public static final String STORAGE_DEPLOYMENT_UBUNTU = "storage-deployment-ubuntu";
    public static final String NETWORK_DEPLOYMENT_UBUNTU = "network-deployment-ubuntu";

    private Capabilities() {
    }
}
