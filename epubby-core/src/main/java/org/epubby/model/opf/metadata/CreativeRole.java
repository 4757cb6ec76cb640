package org.epubby.model.opf.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * The role a creator or contributor had in making a publication, expressed as a MARC relator code.
 * <p>
 * Codes of the MARC relator list resolve to a shared instance that also carries the display name. Any other code is a
 * custom role without a name.
 */
@Getter
@EqualsAndHashCode(of = "code")
public final class CreativeRole {

    private static final String RELATORS_RESOURCE = "/marc-relators.properties";
    private static final Map<String, CreativeRole> DEFAULT_ROLES = loadDefaultRoles();

    public static final CreativeRole AUTHOR = of("aut");
    public static final CreativeRole EDITOR = of("edt");
    public static final CreativeRole ILLUSTRATOR = of("ill");
    public static final CreativeRole TRANSLATOR = of("trl");

    private final String code;
    private final String name;

    private CreativeRole(String code, String name) {
        this.code = code;
        this.name = name;
    }

    public static CreativeRole of(String code) {
        if (StringUtils.isBlank(code)) {
            throw new IllegalArgumentException("A creative role needs a code");
        }
        CreativeRole role = DEFAULT_ROLES.get(code);
        return role != null ? role : new CreativeRole(code, null);
    }

    public static Collection<CreativeRole> getDefaultRoles() {
        return Collections.unmodifiableCollection(DEFAULT_ROLES.values());
    }

    public boolean isDefault() {
        return name != null;
    }

    @Override
    public String toString() {
        return name != null ? code + " (" + name + ")" : code;
    }

    private static Map<String, CreativeRole> loadDefaultRoles() {
        Properties relators = new Properties();
        try (InputStream stream = CreativeRole.class.getResourceAsStream(RELATORS_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing resource " + RELATORS_RESOURCE);
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                relators.load(reader);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RELATORS_RESOURCE, e);
        }
        Map<String, CreativeRole> roles = new TreeMap<>();
        for (String code : relators.stringPropertyNames()) {
            roles.put(code, new CreativeRole(code, relators.getProperty(code)));
        }
        return Collections.unmodifiableMap(roles);
    }
}
