package com.licitador.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Explicit description of how to copy a request object field by field,
 * decrypting the fields marked as encrypted.
 *
 * <p>Built once per request type and kept in a static constant:
 *
 * <pre>{@code
 * static final FieldMapping<LoginRequest> MAPPING = FieldMapping.builder(LoginRequest::new)
 *     .plain("email", LoginRequest::getEmail, LoginRequest::setEmail)
 *     .encrypted("password", LoginRequest::getPassword, LoginRequest::setPassword)
 *     .build();
 * }</pre>
 *
 * <p>Fields not registered are left at the value the factory gives them.
 *
 * @param <T> request type
 */
public final class FieldMapping<T> {

    /**
     * Decrypts the ciphertext of one named field.
     */
    @FunctionalInterface
    public interface FieldDecryptor {
        String decrypt(String fieldName, String ciphertext);
    }

    private final Supplier<T> factory;
    private final List<Field<T, ?>> fields;

    private FieldMapping(Supplier<T> factory, List<Field<T, ?>> fields) {
        this.factory = factory;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static <T> Builder<T> builder(Supplier<T> factory) {
        return new Builder<>(factory);
    }

    /**
     * Build a new instance from {@code source}: encrypted fields with a non-null
     * value go through {@code decryptor} (an empty value stays empty without a
     * call), every other registered field is copied as is.
     *
     * <p>The first exception thrown by {@code decryptor} propagates and the
     * partially filled instance is dropped.
     */
    public T apply(T source, FieldDecryptor decryptor) {
        Objects.requireNonNull(source, "Source must not be null");
        Objects.requireNonNull(decryptor, "Decryptor must not be null");

        T destination = Objects.requireNonNull(factory.get(), "Factory returned null");
        for (Field<T, ?> field : fields) {
            field.copy(source, destination, decryptor);
        }
        return destination;
    }

    public List<String> encryptedFieldNames() {
        return fields.stream()
            .filter(Field::encrypted)
            .map(Field::name)
            .toList();
    }

    public List<String> fieldNames() {
        return fields.stream()
            .map(Field::name)
            .toList();
    }

    private record Field<T, V>(
        String name,
        Function<T, V> getter,
        BiConsumer<T, V> setter,
        boolean encrypted,
        Function<String, V> fromPlaintext
    ) {
        void copy(T source, T destination, FieldDecryptor decryptor) {
            V value = getter.apply(source);
            if (!encrypted || value == null) {
                setter.accept(destination, value);
                return;
            }

            String ciphertext = value.toString();
            String plaintext = ciphertext.isEmpty() ? "" : decryptor.decrypt(name, ciphertext);
            setter.accept(destination, fromPlaintext.apply(plaintext));
        }
    }

    public static final class Builder<T> {

        private final Supplier<T> factory;
        private final List<Field<T, ?>> fields = new ArrayList<>();

        private Builder(Supplier<T> factory) {
            this.factory = Objects.requireNonNull(factory, "Factory must not be null");
        }

        /**
         * Register a field that is copied verbatim.
         */
        public <V> Builder<T> plain(String name, Function<T, V> getter, BiConsumer<T, V> setter) {
            return add(new Field<>(name, getter, setter, false, null));
        }

        /**
         * Register a string field that arrives as base64 RSA-OAEP ciphertext.
         */
        public Builder<T> encrypted(String name, Function<T, String> getter, BiConsumer<T, String> setter) {
            return add(new Field<>(name, getter, setter, true, Function.identity()));
        }

        public FieldMapping<T> build() {
            return new FieldMapping<>(factory, fields);
        }

        private Builder<T> add(Field<T, ?> field) {
            Objects.requireNonNull(field.name(), "Field name must not be null");
            Objects.requireNonNull(field.getter(), "Getter must not be null");
            Objects.requireNonNull(field.setter(), "Setter must not be null");
            if (fields.stream().anyMatch(existing -> existing.name().equals(field.name()))) {
                throw new IllegalArgumentException("Field already mapped: " + field.name());
            }
            fields.add(field);
            return this;
        }
    }
}
