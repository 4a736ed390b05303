package com.querier.tag.family;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.TagFunctionExpression;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;
import com.querier.tag.DeviceRoles;
import com.querier.tag.DeviceTypes;
import com.querier.tag.TagFamily;
import com.querier.tag.TagResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Boolean tag functions used directly as predicates.
 *
 * {@code exist(<resource>)} keeps rows where the resource is present on the
 * given side; resources it cannot check, and unknown functions, match everything.
 */
@Component
public class TagFunctionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(TagFunctionTranslator.class);

    static final String EXIST = "exist";
    static final String TAUTOLOGY = "1=1";

    public FilterNode translate(TagFunctionExpression function) {
        String name = function.getName().toLowerCase(Locale.ROOT);
        if (!EXIST.equals(name)) {
            logger.warn("Unsupported tag function {}, filter is {}", function.getName(), TAUTOLOGY);
            return new ExprNode(TAUTOLOGY);
        }
        if (function.getArgs().size() != 1) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL,
                    String.format("The parameters of function %s are not 1", name));
        }
        return new ExprNode(existFilter(TagResolver.stripTagName(function.getArgs().get(0)).toLowerCase(Locale.ROOT)));
    }

    private static String existFilter(String resource) {
        String suffix = DeviceRoles.suffixOf(resource);
        String resourceNoSuffix = DeviceRoles.stripSuffix(resource);
        String resourceNoId = resourceNoSuffix.endsWith("_id")
                ? resourceNoSuffix.substring(0, resourceNoSuffix.length() - "_id".length())
                : resourceNoSuffix;

        Integer deviceType = DeviceTypes.DEVICE_MAP.get(resourceNoId);
        if (deviceType != null) {
            // pod_service rows carry no device type of their own
            if ("pod_service".equals(resourceNoSuffix)) {
                return TAUTOLOGY;
            }
            return "l3_device_type" + suffix + "=" + deviceType;
        }
        for (TagFamily family : TagFamily.values()) {
            if (family.matches(resourceNoSuffix)) {
                return family.existFilter(suffix, resourceNoSuffix.substring(family.getPrefix().length()));
            }
        }
        Integer tapPortDeviceType = DeviceTypes.TAP_PORT_DEVICE_MAP.get(resourceNoSuffix);
        if (tapPortDeviceType != null) {
            return "(toUInt64(vtap_id),toUInt64(tap_port)) IN (SELECT vtap_id,tap_port FROM flow_tag.vtap_port_map"
                    + " WHERE tap_port!=0 AND device_type=" + tapPortDeviceType + ")";
        }
        logger.debug("exist() cannot check resource {}, filter is {}", resource, TAUTOLOGY);
        return TAUTOLOGY;
    }
}
