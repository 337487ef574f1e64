package com.pgstash.orchestration.model;

import com.pgstash.configuration.exception.ConfigurationException;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Parsed {@code s3://bucket/path} destination.
 */
@Value
public class CloudDestinationUrl {
    private static final String S3_SCHEME = "s3";

    String url;
    String bucketName;
    /**
     * Key prefix inside the bucket, without leading or trailing slash. Empty when the url has no path.
     */
    String path;

    public static CloudDestinationUrl parse(String url) throws ConfigurationException {
        if (url == null) {
            throw new ConfigurationException("Destination URL is missing");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid s3 URL address: " + url, e);
        }

        if (!S3_SCHEME.equals(uri.getScheme()) || StringUtils.isEmpty(uri.getAuthority())) {
            throw new ConfigurationException("Invalid s3 URL address: " + url);
        }

        String path = StringUtils.strip(StringUtils.defaultString(uri.getPath()), "/");
        return new CloudDestinationUrl(url, uri.getAuthority(), path);
    }

    /**
     * Joins the url path with the given parts into an object key.
     */
    public String buildKey(String... parts) {
        StringBuilder key = new StringBuilder(path);
        for (String part : parts) {
            String stripped = StringUtils.strip(part, "/");
            if (stripped.isEmpty()) {
                continue;
            }
            if (key.length() > 0) {
                key.append('/');
            }
            key.append(stripped);
        }
        return key.toString();
    }
}
