package com.querier.tag;

/**
 * Key/value tag families stored in side map tables and addressed as
 * {@code <prefix><key>}, optionally with a {@code _0}/{@code _1} device role suffix
 */
public enum TagFamily {
    K8S_LABEL("k8s.label.", "k8s_label") {
        @Override
        public String membership(String suffix, String condition) {
            return "((toUInt64(service_id" + suffix + ") IN (SELECT id FROM flow_tag.pod_service_k8s_label_map WHERE "
                    + condition + ")) OR (toUInt64(pod_id" + suffix
                    + ") IN (SELECT id FROM flow_tag.pod_k8s_label_map WHERE " + condition + ")))";
        }
    },
    K8S_ANNOTATION("k8s.annotation.", "k8s_annotation") {
        @Override
        public String membership(String suffix, String condition) {
            return "((toUInt64(service_id" + suffix + ") IN (SELECT id FROM flow_tag.pod_service_k8s_annotation_map WHERE "
                    + condition + ")) OR (toUInt64(pod_id" + suffix
                    + ") IN (SELECT id FROM flow_tag.pod_k8s_annotation_map WHERE " + condition + ")))";
        }
    },
    K8S_ENV("k8s.env.", "k8s_env") {
        @Override
        public String membership(String suffix, String condition) {
            return "toUInt64(pod_id" + suffix + ") IN (SELECT id FROM flow_tag.pod_k8s_env_map WHERE " + condition + ")";
        }
    },
    CLOUD_TAG("cloud.tag.", "cloud_tag") {
        @Override
        public String membership(String suffix, String condition) {
            return "((toUInt64(l3_device_id" + suffix + ") IN (SELECT id FROM flow_tag.chost_cloud_tag_map WHERE "
                    + condition + ") AND l3_device_type" + suffix + "=" + DeviceTypes.CHOST + ") OR (toUInt64(pod_ns_id"
                    + suffix + ") IN (SELECT id FROM flow_tag.pod_ns_cloud_tag_map WHERE " + condition + ")))";
        }
    },
    OS_APP("os.app.", "os_app") {
        @Override
        public String membership(String suffix, String condition) {
            return "toUInt64(gprocess_id" + suffix + ") IN (SELECT pid FROM flow_tag.os_app_tag_map WHERE "
                    + condition + ")";
        }
    };

    private final String prefix;
    private final String descriptorName;

    TagFamily(String prefix, String descriptorName) {
        this.prefix = prefix;
        this.descriptorName = descriptorName;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Registry name of the family's descriptor for a device role suffix
     */
    public String descriptorName(String suffix) {
        return descriptorName + suffix;
    }

    public boolean matches(String tagName) {
        return tagName.startsWith(prefix);
    }

    /**
     * Membership predicate over the family's map tables for the given
     * side-table condition
     */
    public abstract String membership(String suffix, String condition);

    /**
     * Predicate matching rows whose resource carries the key at all
     */
    public String existFilter(String suffix, String key) {
        return membership(suffix, "key='" + key + "'");
    }
}
