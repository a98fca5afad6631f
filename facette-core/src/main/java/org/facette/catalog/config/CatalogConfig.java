/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.facette.catalog.config;

import com.google.common.collect.ImmutableMap;
import org.facette.catalog.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog configuration loaded from YAML.
 *
 * <pre>
 * origins:
 *   collectd:
 *     type: rrd
 *     path: /var/lib/collectd/rrd
 *     pattern: (?&lt;source&gt;[^/]+)/(?&lt;metric&gt;.+)\.rrd
 * </pre>
 */
public class CatalogConfig {
    private final static Logger LOG = LoggerFactory.getLogger(CatalogConfig.class);

    public static final String ORIGINS = "origins";

    private final Map<String, Map<String, String>> origins;

    public CatalogConfig(Map<String, Map<String, String>> origins) {
        this.origins = origins;
    }

    /**
     * @param file YAML file to load
     * @return the loaded configuration
     * @throws ConfigException if the file cannot be read or is not a valid configuration
     */
    public static CatalogConfig load(File file) throws ConfigException {
        if (!file.exists() || !file.canRead()) {
            throw new ConfigException("unable to read configuration file `" + file + "'");
        }
        try (InputStream in = new FileInputStream(file)) {
            LOG.info("Loading catalog configuration from {}", file);
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("unable to read configuration file `" + file + "'", e);
        }
    }

    public static CatalogConfig load(Reader reader) throws ConfigException {
        Object loaded;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            loaded = yaml.load(reader);
        } catch (RuntimeException e) {
            throw new ConfigException("malformed configuration: " + e.getMessage(), e);
        }

        if (loaded == null) {
            return new CatalogConfig(ImmutableMap.<String, Map<String, String>>of());
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigException("configuration must be a map");
        }

        Object section = ((Map<?, ?>) loaded).get(ORIGINS);
        if (section == null) {
            return new CatalogConfig(ImmutableMap.<String, Map<String, String>>of());
        }
        if (!(section instanceof Map)) {
            throw new ConfigException("`" + ORIGINS + "' must be a map of origin settings");
        }

        Map<String, Map<String, String>> origins = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) section).entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                throw new ConfigException("settings of origin `" + name + "' must be a map");
            }
            origins.put(name, toSettings((Map<?, ?>) entry.getValue()));
        }
        return new CatalogConfig(origins);
    }

    // connector settings are a flat string bag
    private static Map<String, String> toSettings(Map<?, ?> raw) {
        Map<String, String> settings = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getValue() != null) {
                settings.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
            }
        }
        return settings;
    }

    /**
     * @return origin settings keyed by origin name, in file order
     */
    public Map<String, Map<String, String>> getOrigins() {
        return origins;
    }
}
