/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.code2flowchart.settings;

import lombok.Data;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plus.wcj.code2flowchart.FlowchartException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Mutable flowchart configuration. {@link #load()} reads {@value #RESOURCE} from the classpath
 * and lets JVM system properties with the same keys override it.
 */
@Data
@Accessors(chain = true)
public class FlowchartSettings {
    private static final Logger LOG = LoggerFactory.getLogger(FlowchartSettings.class);

    public static final String RESOURCE = "flowchart.properties";

    public static final String LABEL_MAX_LENGTH = "flowchart.label.max-length";
    public static final String COMPACT_LABEL_MAX_LENGTH = "flowchart.label.compact-max-length";
    public static final String ARGUMENT_LABEL_MAX_LENGTH = "flowchart.label.argument-max-length";
    public static final String EXPAND_CLOSURE_ARGUMENTS = "flowchart.closures.expand-arguments";
    public static final String COMPLEXITY_LOW = "flowchart.complexity.low";
    public static final String COMPLEXITY_MEDIUM = "flowchart.complexity.medium";
    public static final String COMPLEXITY_HIGH = "flowchart.complexity.high";

    private int labelMaxLength = 80;
    private int compactLabelMaxLength = 30;
    private int argumentLabelMaxLength = 15;
    private boolean expandClosureArguments = true;
    private int complexityLowThreshold = 5;
    private int complexityMediumThreshold = 10;
    private int complexityHighThreshold = 20;

    public static FlowchartSettings load() {
        Properties properties = new Properties();
        ClassLoader loader = FlowchartSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOG.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new FlowchartException("Unable to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("flowchart.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    public static FlowchartSettings fromProperties(Properties properties) {
        FlowchartSettings settings = new FlowchartSettings();
        return settings
                .setLabelMaxLength(intValue(properties, LABEL_MAX_LENGTH, settings.labelMaxLength))
                .setCompactLabelMaxLength(intValue(properties, COMPACT_LABEL_MAX_LENGTH, settings.compactLabelMaxLength))
                .setArgumentLabelMaxLength(intValue(properties, ARGUMENT_LABEL_MAX_LENGTH, settings.argumentLabelMaxLength))
                .setExpandClosureArguments(booleanValue(properties, EXPAND_CLOSURE_ARGUMENTS, settings.expandClosureArguments))
                .setComplexityLowThreshold(intValue(properties, COMPLEXITY_LOW, settings.complexityLowThreshold))
                .setComplexityMediumThreshold(intValue(properties, COMPLEXITY_MEDIUM, settings.complexityMediumThreshold))
                .setComplexityHighThreshold(intValue(properties, COMPLEXITY_HIGH, settings.complexityHighThreshold));
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new FlowchartException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw.trim());
    }
}
