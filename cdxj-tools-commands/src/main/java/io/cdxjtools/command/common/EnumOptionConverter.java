/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cdxjtools.command.common;

import picocli.CommandLine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converts option values such as {@code trust-count} to enum constants such as
 * {@code TRUST_COUNT}, ignoring case and treating dashes as underscores.
 *
 * @param <E> the enum type
 */
public abstract class EnumOptionConverter<E extends Enum<E>> implements CommandLine.ITypeConverter<E> {

    private final Class<E> type;

    protected EnumOptionConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public E convert(String value) {
        String name = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(
                "'" + value + "' is not one of " + choices(type));
        }
    }

    /**
     * @param type the enum type
     * @param <E>  the enum type
     * @return the accepted spellings, lower case with dashes
     */
    public static <E extends Enum<E>> String choices(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
            .map(c -> c.name().toLowerCase(Locale.ROOT).replace('_', '-'))
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
