// file: src/main/java/io/logstats/storage/dto/JsonStatLogConfig.java
package io.logstats.storage.dto;

public class JsonStatLogConfig {
    public String fileName;
    public Long sizeLimit;
    public Integer numFiles;
    public String timestampFormat;
    public Boolean durable;
    public Boolean compress;
    public Boolean dedupe;
}
