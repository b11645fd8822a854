package com.example.memegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String templatesPrefix = "templates";
    private String customPrefix = "custom";
    private String outPrefix = "out";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getTemplatesPrefix() { return templatesPrefix; }
    public void setTemplatesPrefix(String templatesPrefix) { this.templatesPrefix = templatesPrefix; }

    public String getCustomPrefix() { return customPrefix; }
    public void setCustomPrefix(String customPrefix) { this.customPrefix = customPrefix; }

    public String getOutPrefix() { return outPrefix; }
    public void setOutPrefix(String outPrefix) { this.outPrefix = outPrefix; }
}
