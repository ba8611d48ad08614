package com.streamgate.trigger.http;

import com.streamgate.types.common.Constants;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 解析请求方身份：限流身份优先取 X-Api-Key，其次为远端地址。
 */
@Component
public class ClientIdentityResolver {

    private static final String API_KEY_PREFIX = "key:";
    private static final String UNKNOWN_ADDRESS = "unknown";

    public String resolveClientId(HttpServletRequest request) {
        String apiKey = StringUtils.trimToNull(request.getHeader(Constants.HEADER_API_KEY));
        if (apiKey != null) {
            return API_KEY_PREFIX + apiKey;
        }
        return resolveAddress(request);
    }

    /**
     * X-Forwarded-For 的第一跳，缺省为 servlet 远端地址。
     */
    public String resolveAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(Constants.HEADER_FORWARDED_FOR);
        if (StringUtils.isNotBlank(forwarded)) {
            String firstHop = StringUtils.trimToNull(StringUtils.substringBefore(forwarded, Constants.SPLIT));
            if (firstHop != null) {
                return firstHop;
            }
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), UNKNOWN_ADDRESS);
    }

}
