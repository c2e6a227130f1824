/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.rasterio.async;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Options of an asynchronous read request.
 * <p>
 * A loosely typed set of parameter values keyed by name. Backends describe the
 * parameters they understand with {@link RasterParameter}s and read them back with
 * {@link #getParameter(RasterParameter)}; unknown keys are carried along and ignored.
 */
public class AsyncReadOptions {

    /** Key of {@link #END_TIMEOUT_MILLIS}. */
    public static final String END_TIMEOUT_KEY = "io.tileverse.rasterio.async.endTimeoutMillis";

    /**
     * Upper bound, in milliseconds, {@link AsyncReadRequest#close()} waits for the decoder to stop.
     */
    public static final RasterParameter<Integer> END_TIMEOUT_MILLIS = RasterParameter.builder()
            .key(END_TIMEOUT_KEY)
            .title("End timeout")
            .description("Maximum time in milliseconds to wait for a cancelled decoder to stop when a request is ended")
            .type(Integer.class)
            .group(RasterParameter.GROUP_ASYNC)
            .defaultValue(30_000)
            .options(1_000, 30_000, 120_000)
            .build();

    private final Map<String, Object> parameterValues = new HashMap<>();

    public AsyncReadOptions() {
        // empty options
    }

    /**
     * Sets a parameter value by its key. The value is not validated.
     *
     * @param key The key of the parameter.
     * @param value The value of the parameter, {@code null} removes it.
     * @return this instance for method chaining
     */
    public AsyncReadOptions setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            parameterValues.remove(key);
        } else {
            parameterValues.put(key, value);
        }
        return this;
    }

    /**
     * Sets a parameter value.
     *
     * @param <T> the type of the parameter value
     * @param param The parameter descriptor.
     * @param value The value of the parameter.
     * @return this instance for method chaining
     */
    public <T> AsyncReadOptions setParameter(RasterParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * @param <T> The type of the parameter value.
     * @param param The parameter definition.
     * @return the value set for the parameter, or its default value if not set
     */
    public <T> Optional<T> getParameter(RasterParameter<T> param) {
        return getParameter(param.key(), param.type()).or(param::defaultValue);
    }

    /**
     * @param key The key of the parameter.
     * @return the raw value of the parameter, or empty if not set
     */
    public Optional<Object> getParameter(String key) {
        return getParameter(key, Object.class);
    }

    /**
     * Retrieves the value of a parameter by its key and converts it to the specified type.
     *
     * @param <T> The target type for the parameter value.
     * @param key The key of the parameter.
     * @param type The target type.
     * @return the converted value, or empty if not set
     * @throws IllegalArgumentException if the value cannot be converted to the specified type.
     */
    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(value, type));
    }

    /**
     * @return the {@link #END_TIMEOUT_MILLIS} value as a duration
     */
    public Duration endTimeout() {
        return Duration.ofMillis(getParameter(END_TIMEOUT_MILLIS).orElse(30_000));
    }

    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        Object converted;
        try {
            if (type.equals(String.class)) {
                converted = String.valueOf(value);
            } else if (type.equals(Boolean.class)) {
                converted = Boolean.valueOf(String.valueOf(value));
            } else if (type.equals(Integer.class)) {
                converted = value instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(value).trim());
            } else if (type.equals(Long.class)) {
                converted = value instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(value).trim());
            } else {
                throw new IllegalArgumentException("Unsupported conversion %s to %s"
                        .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot convert '%s' to %s".formatted(value, type.getSimpleName()), e);
        }
        return type.cast(converted);
    }

    /**
     * @return the parameter values as string properties
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        parameterValues.forEach((name, v) -> properties.setProperty(name, String.valueOf(v)));
        return properties;
    }

    /**
     * Creates options from a {@link Properties} object, one parameter per entry.
     *
     * @param properties the properties to convert
     * @return new options
     */
    public static AsyncReadOptions fromProperties(Properties properties) {
        requireNonNull(properties);
        AsyncReadOptions options = new AsyncReadOptions();
        properties.forEach((k, v) -> options.setParameter(String.valueOf(k), v));
        return options;
    }

    /**
     * Creates options populated with the default values of the given parameters.
     *
     * @param parameters the parameter descriptors
     * @return new options
     */
    public static AsyncReadOptions withDefaults(List<RasterParameter<?>> parameters) {
        AsyncReadOptions options = new AsyncReadOptions();
        parameters.stream()
                .filter(p -> p.defaultValue().isPresent())
                .forEach(p -> options.setParameter(p.key(), p.defaultValue().orElseThrow()));
        return options;
    }

    @Override
    public String toString() {
        return "AsyncReadOptions" + parameterValues;
    }
}
