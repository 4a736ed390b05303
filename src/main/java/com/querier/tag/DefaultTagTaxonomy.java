package com.querier.tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Built-in tag taxonomy of the flow, metrics and Prometheus databases.
 *
 * Every resource tag is registered with its {@code _0}/{@code _1} device
 * role variants; columns carry the same suffix as the tag.
 */
public final class DefaultTagTaxonomy {

    private static final Logger log = LoggerFactory.getLogger(DefaultTagTaxonomy.class);

    public static final String DB_FLOW_LOG = "flow_log";
    public static final String DB_FLOW_METRICS = "flow_metrics";
    public static final String DB_EXT_METRICS = "ext_metrics";
    public static final String DB_DEEPFLOW_SYSTEM = "deepflow_system";
    public static final String DB_PROMETHEUS = "prometheus";
    public static final String DB_EVENT = "event";

    public static final String TABLE_L7_FLOW_LOG = "l7_flow_log";

    private static final String ANY = TagDescriptionRegistry.ANY_TABLE;
    private static final List<String> SUFFIXES = List.of("", DeviceRoles.CLIENT_SUFFIX, DeviceRoles.SERVER_SUFFIX);
    private static final List<String> RESOURCE_DBS = List.of(DB_FLOW_LOG, DB_FLOW_METRICS, DB_EVENT);

    private DefaultTagTaxonomy() {
        throw new UnsupportedOperationException("DefaultTagTaxonomy is a utility class and cannot be instantiated");
    }

    public static TagRegistry build(TagDescriptionRegistry descriptions) {
        TagRegistry registry = new TagRegistry(descriptions);
        for (String db : RESOURCE_DBS) {
            for (String suffix : SUFFIXES) {
                registerDeviceResources(registry, db, suffix);
                registerMappedResources(registry, db, suffix);
                registerServiceResources(registry, db, suffix);
                registerAutoGroups(registry, db, suffix);
                registerNetworkTags(registry, db, suffix);
            }
            registry.register(db, ANY, TagDescriptor.builder("ip_version")
                    .encoding(ValueEncoding.IP_VERSION)
                    .where((op, value) -> "is_ipv4 " + op + " " + value)
                    .build());
        }
        for (String db : List.of(DB_FLOW_LOG, DB_FLOW_METRICS, DB_EXT_METRICS, DB_EVENT)) {
            for (String suffix : SUFFIXES) {
                registerFamilies(registry, db, suffix);
            }
        }

        registry.register(DB_FLOW_LOG, ANY, TagDescriptor.builder("_id")
                .encoding(ValueEncoding.ID)
                .where((op, value) -> "_id " + op + " " + value
                        + " AND time=toDateTime(bitShiftRight(" + value + ", 32))")
                .build());
        registry.register(DB_FLOW_METRICS, ANY, TagDescriptor.builder("acl_gids")
                .encoding(ValueEncoding.ARRAY)
                .where((op, value) -> "hasAny(acl_gids, [" + value + "])")
                .build());

        registry.registerKeyed(DB_FLOW_LOG, TABLE_L7_FLOW_LOG, freeForm("attribute.", "attribute"));
        for (String db : List.of(DB_EXT_METRICS, DB_DEEPFLOW_SYSTEM)) {
            registry.registerKeyed(db, ANY, freeForm("tag.", "tag"));
        }
        log.info("Tag taxonomy built for databases {}", List.of(DB_FLOW_LOG, DB_FLOW_METRICS, DB_EVENT,
                DB_EXT_METRICS, DB_DEEPFLOW_SYSTEM));
        return registry;
    }

    /**
     * Resources identified through {@code l3_device_id} plus a device type discriminator
     */
    private static void registerDeviceResources(TagRegistry registry, String db, String s) {
        List<String> resources = List.of("chost", "vrouter", "dhcpgw", "redis", "rds", "lb", "natgw");
        for (String resource : resources) {
            int type = DeviceTypes.DEVICE_MAP.get(resource);
            String deviceFilter = " AND l3_device_type" + s + "=" + type;
            String membership = "toUInt64(l3_device_id" + s + ") IN (SELECT deviceid FROM flow_tag.device_map WHERE ";
            registry.register(db, ANY, TagDescriptor.builder(resource + s)
                    .category(TagCategory.SUBQUERY)
                    .where((op, value) -> membership + "name " + op + " " + value
                            + " AND devicetype=" + type + ")" + deviceFilter)
                    .whereRegexp((op, value) -> membership + op + "(name," + value + ")"
                            + " AND devicetype=" + type + ")" + deviceFilter)
                    .build());
            boolean subqueryId = "lb".equals(resource) || "natgw".equals(resource);
            registry.register(db, ANY, TagDescriptor.builder(resource + "_id" + s)
                    .category(subqueryId ? TagCategory.SUBQUERY : TagCategory.PLAIN)
                    .where((op, value) -> "l3_device_id" + s + " " + op + " " + value + deviceFilter)
                    .build());
        }
    }

    /**
     * Resources with a dedicated id column and {@code flow_tag.<resource>_map} lookup table
     */
    private static void registerMappedResources(TagRegistry registry, String db, String s) {
        String[][] resources = {
                {"host", "host_id", "host_map"},
                {"pod", "pod_id", "pod_map"},
                {"pod_node", "pod_node_id", "pod_node_map"},
                {"pod_ns", "pod_ns_id", "pod_ns_map"},
                {"pod_group", "pod_group_id", "pod_group_map"},
                {"pod_cluster", "pod_cluster_id", "pod_cluster_map"},
                {"gprocess", "gprocess_id", "gprocess_map"},
                {"vpc", "l3_epc_id", "l3_epc_map"},
                {"subnet", "subnet_id", "subnet_map"},
                {"region", "region_id", "region_map"},
                {"az", "az_id", "az_map"},
        };
        for (String[] resource : resources) {
            String column = resource[1] + s;
            String membership = "toUInt64(" + column + ") IN (SELECT id FROM flow_tag." + resource[2] + " WHERE ";
            registry.register(db, ANY, TagDescriptor.builder(resource[0] + s)
                    .category(TagCategory.SUBQUERY)
                    .where((op, value) -> membership + "name " + op + " " + value + ")")
                    .whereRegexp((op, value) -> membership + op + "(name," + value + "))")
                    .build());
            registry.register(db, ANY, TagDescriptor.builder(resource[0] + "_id" + s)
                    .where((op, value) -> column + " " + op + " " + value)
                    .build());
        }
    }

    /**
     * Kubernetes service side tags resolved through membership subqueries
     */
    private static void registerServiceResources(TagRegistry registry, String db, String s) {
        String service = "toUInt64(service_id" + s + ") IN (SELECT id FROM flow_tag.pod_service_map WHERE ";
        registerSubqueryPair(registry, db, "pod_service" + s, service, "name");
        registerSubqueryPair(registry, db, "pod_service_id" + s, service, "id");

        String ingress = "toUInt64(service_id" + s + ") IN (SELECT pod_service_id FROM flow_tag.pod_ingress_map WHERE ";
        registerSubqueryPair(registry, db, "pod_ingress" + s, ingress, "name");
        registerSubqueryPair(registry, db, "pod_ingress_id" + s, ingress, "id");

        String listener = "toUInt64(lb_listener_id" + s + ") IN (SELECT id FROM flow_tag.lb_listener_map WHERE ";
        registerSubqueryPair(registry, db, "lb_listener" + s, listener, "name");
        registerSubqueryPair(registry, db, "lb_listener_id" + s, listener, "id");
    }

    private static void registerSubqueryPair(TagRegistry registry, String db, String name,
                                             String membership, String column) {
        registry.register(db, ANY, TagDescriptor.builder(name)
                .category(TagCategory.SUBQUERY)
                .where((op, value) -> membership + column + " " + op + " " + value + ")")
                .whereRegexp((op, value) -> membership + op + "(" + column + "," + value + "))")
                .build());
    }

    /**
     * Auto-grouped resources: a device when the group type names one, the IP otherwise.
     * The operator and value appear in both branches.
     */
    private static void registerAutoGroups(TagRegistry registry, String db, String s) {
        String[][] groups = {
                {"auto_instance", "auto_instance"},
                {"auto_service", "auto_service"},
                {"resource_gl0", "auto_instance"},
                {"resource_gl1", "auto_instance"},
                {"resource_gl2", "auto_service"},
        };
        String ip = "if(is_ipv4=1, IPv4NumToString(ip4" + s + "), IPv6NumToString(ip6" + s + "))";
        for (String[] group : groups) {
            String id = group[1] + "_id" + s;
            String type = group[1] + "_type" + s;
            String device = "(toUInt64(" + id + ") IN (SELECT deviceid FROM flow_tag.device_map WHERE ";
            String ipBranch = "(" + type + " IN (0,255) AND ";
            registry.register(db, ANY, TagDescriptor.builder(group[0] + s)
                    .where((op, value) -> "(" + device + "name " + op + " " + value + ")) OR "
                            + ipBranch + ip + " " + op + " " + value + "))")
                    .whereRegexp((op, value) -> "(" + device + op + "(name," + value + "))) OR "
                            + ipBranch + op + "(" + ip + "," + value + ")))")
                    .build());
            registry.register(db, ANY, TagDescriptor.builder(group[0] + "_id" + s)
                    .where((op, value) -> "((" + type + " NOT IN (0,255) AND " + id + " " + op + " " + value + ") OR "
                            + ipBranch + "0 " + op + " " + value + "))")
                    .build());
        }
    }

    private static void registerNetworkTags(TagRegistry registry, String db, String s) {
        registry.register(db, ANY, TagDescriptor.builder("ip" + s)
                .encoding(ValueEncoding.IP)
                .where((op, value) -> "if(is_ipv4=1, hex(ip4" + s + "), hex(ip6" + s + ")) " + op + " " + value)
                .build());
        registry.register(db, ANY, TagDescriptor.builder("nat_real_ip" + s)
                .encoding(ValueEncoding.IP)
                .where((op, value) -> "hex(nat_real_ip4" + s + ") " + op + " " + value)
                .build());
        if (!s.isEmpty()) {
            for (String direction : List.of("tx", "rx")) {
                String v4 = "tunnel_" + direction + "_ip4" + s;
                String v6 = "tunnel_" + direction + "_ip6" + s;
                registry.register(db, ANY, TagDescriptor.builder("tunnel_" + direction + "_ip" + s)
                        .encoding(ValueEncoding.IP)
                        .where((op, value) -> "if(tunnel_is_ipv4=1, hex(" + v4 + "), hex(" + v6 + ")) "
                                + op + " " + value)
                        .build());
            }
        }
        registry.register(db, ANY, TagDescriptor.builder("is_internet" + s)
                .encoding(ValueEncoding.BOOLEAN_TRI_STATE)
                .where((op, value) -> "l3_epc_id" + s + " " + op + " -2")
                .build());
    }

    private static void registerFamilies(TagRegistry registry, String db, String s) {
        for (TagFamily family : TagFamily.values()) {
            registry.registerKeyed(db, ANY, new KeyedTagDescriptor(family.descriptorName(s), TagCategory.SUBQUERY,
                    (key, op, value) -> family.membership(s, "value " + op + " " + value + " and key='" + key + "'"),
                    (key, op, value) -> family.membership(s, op + "(value," + value + ") and key='" + key + "'")));
        }
    }

    private static KeyedTagDescriptor freeForm(String name, String column) {
        String element = column + "_values[indexOf(" + column + "_names,'";
        return new KeyedTagDescriptor(name, TagCategory.PLAIN,
                (key, op, value) -> element + key + "')] " + op + " " + value,
                (key, op, value) -> op + "(" + element + key + "')]," + value + ")");
    }
}
