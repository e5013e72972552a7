package com.finlens.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "finlens.csv")
public class CsvProperties {

    /**
     * Encodings tried in order when decoding CSV bytes. "UTF-8-BOM" is UTF-8 with a leading byte-order mark.
     */
    private List<String> encodings = new ArrayList<>(List.of("UTF-8", "UTF-8-BOM", "ISO-8859-1", "windows-1252"));
}
