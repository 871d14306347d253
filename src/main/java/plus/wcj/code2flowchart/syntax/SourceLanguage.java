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

package plus.wcj.code2flowchart.syntax;

import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterRust;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

public enum SourceLanguage {
    CPP("cpp", TreeSitterCpp::new, ".cpp", ".cc", ".cxx", ".c++", ".hpp", ".hh", ".hxx", ".h"),
    JAVA("java", TreeSitterJava::new, ".java"),
    RUST("rust", TreeSitterRust::new, ".rs");

    private final String id;
    private final Supplier<TSLanguage> grammar;
    private final List<String> extensions;

    SourceLanguage(String id, Supplier<TSLanguage> grammar, String... extensions) {
        this.id = id;
        this.grammar = grammar;
        this.extensions = List.of(extensions);
    }

    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    TSLanguage newGrammar() {
        return grammar.get();
    }

    public static Optional<SourceLanguage> fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(language -> language.extensions.stream().anyMatch(lower::endsWith))
                .findFirst();
    }

    public static Optional<SourceLanguage> fromId(String id) {
        return Arrays.stream(values())
                .filter(language -> language.id.equalsIgnoreCase(id))
                .findFirst();
    }
}
