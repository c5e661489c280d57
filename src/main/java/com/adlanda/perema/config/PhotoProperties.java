package com.adlanda.perema.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where uploaded contact photos live on disk and under which URL they are served.
 * Registered by {@link WebConfig}.
 */
@ConfigurationProperties(prefix = "perema.photos")
public class PhotoProperties {

    private String directory = "./data/photos";

    private String urlPrefix = "/photos";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getUrlPrefix() {
        return urlPrefix;
    }

    public void setUrlPrefix(String urlPrefix) {
        this.urlPrefix = urlPrefix;
    }
}
