package org.epubby.model.opf.metadata;

import lombok.extern.slf4j.Slf4j;
import org.epubby.property.Property;
import org.epubby.property.PropertyResolver;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the {@link Opf3MetaConverter}s, keyed by the absolute IRI their scheme expands to. Converter schemes are
 * expanded against the reserved prefixes, schemes read from a package against its own {@code prefix} mappings, so
 * {@code marc:relators} and {@code loc:relators} with {@code prefix="loc: http://id.loc.gov/vocabulary/"} find the
 * same converter. A meta whose scheme has no converter keeps its value as a string.
 */
@Slf4j
public class Opf3MetaConverters {

    private static final Opf3MetaConverter<String> STRING_CONVERTER = new Opf3MetaConverter<>() {
        @Override
        public Property getScheme() {
            return null;
        }

        @Override
        public Class<String> getValueType() {
            return String.class;
        }

        @Override
        public String decode(String value) {
            return value;
        }

        @Override
        public String encode(String value) {
            return value;
        }
    };

    private final Map<String, Opf3MetaConverter<?>> converters = new LinkedHashMap<>();

    public Opf3MetaConverters(Collection<? extends Opf3MetaConverter<?>> converters) {
        converters.forEach(this::register);
    }

    /**
     * A registry holding only the built-in {@link MarcRelatorConverter}.
     */
    public static Opf3MetaConverters withDefaults() {
        Opf3MetaConverters registry = new Opf3MetaConverters(List.of());
        registry.register(new MarcRelatorConverter());
        return registry;
    }

    /**
     * @throws IllegalArgumentException if another converter already handles the same scheme
     */
    public void register(Opf3MetaConverter<?> converter) {
        Property scheme = converter.getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("Converter " + converter.getClass().getName() + " has no scheme");
        }
        Opf3MetaConverter<?> existing = converters.putIfAbsent(keyOf(scheme, PropertyResolver.RESERVED), converter);
        if (existing != null && existing != converter) {
            throw new IllegalArgumentException("Scheme '" + scheme + "' is already handled by " + existing.getClass().getName());
        }
        log.debug("Registered meta converter for scheme '{}' ({})", scheme, converter.getValueType().getSimpleName());
    }

    public boolean isRegistered(Property scheme) {
        return find(scheme) != null;
    }

    public Opf3MetaConverter<?> find(Property scheme) {
        return find(scheme, PropertyResolver.RESERVED);
    }

    /**
     * The converter for {@code scheme} with its prefix resolved by {@code resolver}.
     */
    public Opf3MetaConverter<?> find(Property scheme, PropertyResolver resolver) {
        return scheme == null ? null : converters.get(keyOf(scheme, resolver));
    }

    private static String keyOf(Property scheme, PropertyResolver resolver) {
        return resolver.key(scheme, null);
    }

    public <T> Opf3Meta<T> create(Opf3MetaConverter<T> converter, Property property, T value) {
        return new Opf3Meta<>(converter, property, value);
    }

    public Opf3Meta<String> createString(Property property, String value) {
        return new Opf3Meta<>(STRING_CONVERTER, property, value);
    }

    /**
     * A string valued meta with an unregistered {@code scheme}.
     *
     * @throws KnownOpf3MetaSchemeException if {@code scheme} has a converter
     */
    public Opf3Meta<String> createString(Property property, String value, Property scheme) {
        return createString(property, value, scheme, PropertyResolver.RESERVED);
    }

    private Opf3Meta<String> createString(Property property, String value, Property scheme, PropertyResolver resolver) {
        if (scheme == null) {
            return createString(property, value);
        }
        Opf3MetaConverter<?> known = find(scheme, resolver);
        if (known != null) {
            throw new KnownOpf3MetaSchemeException(scheme, known.getValueType());
        }
        return new Opf3Meta<>(new UnregisteredSchemeConverter(scheme), property, value);
    }

    /**
     * Decodes {@code value} with the converter of {@code scheme}, or keeps it as a string when there is none.
     *
     * @throws IllegalArgumentException if the converter rejects {@code value}
     */
    public Opf3Meta<?> decode(Property property, String value, Property scheme) {
        return decode(property, value, scheme, PropertyResolver.RESERVED);
    }

    /**
     * As {@link #decode(Property, String, Property)}, resolving the prefix of {@code scheme} with {@code resolver}.
     * The meta keeps {@code scheme} as written.
     */
    public Opf3Meta<?> decode(Property property, String value, Property scheme, PropertyResolver resolver) {
        Opf3MetaConverter<?> converter = find(scheme, resolver);
        if (converter == null) {
            return createString(property, value, scheme, resolver);
        }
        return decodeWith(converter, property, value, scheme);
    }

    private static <T> Opf3Meta<T> decodeWith(Opf3MetaConverter<T> converter, Property property, String value,
                                              Property scheme) {
        Opf3MetaConverter<T> written = scheme.equals(converter.getScheme())
                ? converter
                : new PrefixedSchemeConverter<>(converter, scheme);
        return new Opf3Meta<>(written, property, converter.decode(value));
    }

    /**
     * A registered converter reached through a package-declared prefix. Reports the scheme as the package wrote it.
     */
    private record PrefixedSchemeConverter<T>(Opf3MetaConverter<T> delegate, Property scheme)
            implements Opf3MetaConverter<T> {
        @Override
        public Property getScheme() {
            return scheme;
        }

        @Override
        public Class<T> getValueType() {
            return delegate.getValueType();
        }

        @Override
        public T decode(String value) {
            return delegate.decode(value);
        }

        @Override
        public String encode(T value) {
            return delegate.encode(value);
        }
    }

    private record UnregisteredSchemeConverter(Property scheme) implements Opf3MetaConverter<String> {
        @Override
        public Property getScheme() {
            return scheme;
        }

        @Override
        public Class<String> getValueType() {
            return String.class;
        }

        @Override
        public String decode(String value) {
            return value;
        }

        @Override
        public String encode(String value) {
            return value;
        }
    }
}
