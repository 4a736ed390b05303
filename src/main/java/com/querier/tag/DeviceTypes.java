package com.querier.tag;

import java.util.Map;

/**
 * Device type discriminators stored in {@code l3_device_type} and in the
 * {@code flow_tag} lookup tables
 */
public final class DeviceTypes {

    public static final int CHOST = 1;
    public static final int VROUTER = 5;
    public static final int HOST = 6;
    public static final int DHCP_PORT = 9;
    public static final int POD = 10;
    public static final int POD_SERVICE = 11;
    public static final int REDIS = 12;
    public static final int RDS = 13;
    public static final int POD_NODE = 14;
    public static final int LB = 15;
    public static final int NAT_GATEWAY = 16;
    public static final int POD_GROUP = 101;
    public static final int SERVICE = 102;
    public static final int POD_CLUSTER = 103;
    public static final int GPROCESS = 120;

    /** resource name to device type */
    public static final Map<String, Integer> DEVICE_MAP = Map.ofEntries(
            Map.entry("chost", CHOST),
            Map.entry("vrouter", VROUTER),
            Map.entry("host", HOST),
            Map.entry("dhcpgw", DHCP_PORT),
            Map.entry("pod", POD),
            Map.entry("pod_service", POD_SERVICE),
            Map.entry("redis", REDIS),
            Map.entry("rds", RDS),
            Map.entry("pod_node", POD_NODE),
            Map.entry("lb", LB),
            Map.entry("natgw", NAT_GATEWAY),
            Map.entry("pod_group", POD_GROUP),
            Map.entry("service", SERVICE),
            Map.entry("pod_cluster", POD_CLUSTER),
            Map.entry("gprocess", GPROCESS));

    /** tap port resource name to the device type of the capture interface */
    public static final Map<String, Integer> TAP_PORT_DEVICE_MAP = Map.of(
            "tap_port_host", HOST,
            "tap_port_chost", CHOST,
            "tap_port_pod_node", POD_NODE);

    private DeviceTypes() {
        throw new UnsupportedOperationException("DeviceTypes is a utility class and cannot be instantiated");
    }
}
