/*
 * (c) Copyright 2024 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.rangefeed.impl;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.Strings;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import javax.annotation.Nullable;

public final class ProcessorConfigs {
    public static final String RANGEFEED_CONFIG_OBJECT_PATH = "/rangefeed";

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper(new YAMLFactory()
                    .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
            .registerModule(new GuavaModule())
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule());

    private ProcessorConfigs() {
        // uninstantiable
    }

    public static ProcessorConfig load(File configFile) throws IOException {
        return load(configFile, RANGEFEED_CONFIG_OBJECT_PATH);
    }

    public static ProcessorConfig load(InputStream configStream) throws IOException {
        return load(configStream, RANGEFEED_CONFIG_OBJECT_PATH);
    }

    public static ProcessorConfig load(File configFile, @Nullable String configRoot) throws IOException {
        return getConfig(OBJECT_MAPPER.readTree(configFile), configRoot);
    }

    public static ProcessorConfig load(InputStream configStream, @Nullable String configRoot) throws IOException {
        return getConfig(OBJECT_MAPPER.readTree(configStream), configRoot);
    }

    public static ProcessorConfig loadFromString(String fileContents, @Nullable String configRoot)
            throws IOException {
        return getConfig(OBJECT_MAPPER.readTree(fileContents), configRoot);
    }

    private static ProcessorConfig getConfig(JsonNode node, @Nullable String configRoot) throws IOException {
        JsonNode configNode = findRoot(node, configRoot);
        if (configNode == null) {
            throw new SafeIllegalArgumentException(
                    "Could not find the config root in input", SafeArg.of("configRoot", configRoot));
        }
        return OBJECT_MAPPER.treeToValue(configNode, ProcessorConfig.class);
    }

    @Nullable
    private static JsonNode findRoot(@Nullable JsonNode node, @Nullable String configRoot) {
        if (node == null || node.isMissingNode()) {
            return null;
        }
        if (Strings.isNullOrEmpty(configRoot)) {
            return node;
        }

        JsonNode root = node.at(JsonPointer.compile(configRoot));
        if (root.isMissingNode()) {
            return null;
        }
        return root;
    }
}
