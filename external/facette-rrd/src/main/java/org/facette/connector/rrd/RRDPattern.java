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
package org.facette.connector.rrd;

import org.facette.catalog.ConfigException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles and validates discovery patterns. A pattern names exactly two
 * groups, {@code source} and {@code metric}, in any order.
 */
final class RRDPattern {
    static final String SOURCE = "source";
    static final String METRIC = "metric";

    private RRDPattern() {
    }

    /**
     * @param pattern discovery pattern, Java or {@code (?P<name>...)} group syntax
     * @return the compiled pattern
     * @throws ConfigException if the pattern is invalid, names another group or
     *     lacks one of the two keywords
     */
    static Pattern compile(String pattern) throws ConfigException {
        List<String> names = new ArrayList<>();
        String expression = scan(pattern, names);

        Pattern compiled;
        try {
            compiled = Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw new ConfigException("invalid pattern `" + pattern + "': " + e.getDescription(), e);
        }

        Set<String> groups = new HashSet<>();
        for (String key : names) {
            if (!SOURCE.equals(key) && !METRIC.equals(key)) {
                throw new ConfigException("invalid pattern keyword `" + key + "'");
            }
            groups.add(key);
        }

        if (!groups.contains(SOURCE)) {
            throw new ConfigException("missing pattern keyword `" + SOURCE + "'");
        } else if (!groups.contains(METRIC)) {
            throw new ConfigException("missing pattern keyword `" + METRIC + "'");
        }

        return compiled;
    }

    /**
     * Collects the named groups of a pattern and rewrites {@code (?P<name>} to
     * {@code (?<name>}. Escapes, quoted sections and character classes are
     * copied as is.
     */
    private static String scan(String pattern, List<String> names) {
        StringBuilder out = new StringBuilder(pattern.length());
        int length = pattern.length();
        int classDepth = 0;
        int i = 0;

        while (i < length) {
            char c = pattern.charAt(i);

            if (c == '\\') {
                if (i + 1 < length && pattern.charAt(i + 1) == 'Q') {
                    int end = pattern.indexOf("\\E", i + 2);
                    int stop = end < 0 ? length : end + 2;
                    out.append(pattern, i, stop);
                    i = stop;
                } else {
                    int stop = Math.min(i + 2, length);
                    out.append(pattern, i, stop);
                    i = stop;
                }
                continue;
            }

            if (classDepth > 0) {
                if (c == '[') {
                    classDepth++;
                } else if (c == ']') {
                    classDepth--;
                }
                out.append(c);
                i++;
                continue;
            }

            if (c == '[') {
                classDepth = 1;
                out.append(c);
                i++;
                if (i < length && pattern.charAt(i) == '^') {
                    out.append('^');
                    i++;
                }
                // a leading ] is a literal
                if (i < length && pattern.charAt(i) == ']') {
                    out.append(']');
                    i++;
                }
                continue;
            }

            if (c == '(' && pattern.startsWith("(?", i)) {
                int nameStart = -1;
                if (pattern.startsWith("(?P<", i)) {
                    nameStart = i + 4;
                } else if (pattern.startsWith("(?<", i)) {
                    nameStart = i + 3;
                }
                if (nameStart >= 0 && nameStart < length && isAsciiLetter(pattern.charAt(nameStart))) {
                    int nameEnd = nameStart;
                    while (nameEnd < length && (isAsciiLetter(pattern.charAt(nameEnd))
                            || Character.isDigit(pattern.charAt(nameEnd)))) {
                        nameEnd++;
                    }
                    names.add(pattern.substring(nameStart, nameEnd));
                    out.append("(?<");
                    i = nameStart;
                    continue;
                }
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
