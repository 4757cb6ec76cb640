package org.epubby.model.opf.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CreativeRoleTest {

    @Test
    void relatorCodesResolveToSharedInstances() {
        CreativeRole author = CreativeRole.of("aut");

        assertSame(CreativeRole.AUTHOR, author);
        assertEquals("Author", author.getName());
        assertTrue(author.isDefault());
        assertEquals("Translator", CreativeRole.TRANSLATOR.getName());
    }

    @Test
    void unknownCodesBecomeCustomRoles() {
        CreativeRole custom = CreativeRole.of("xyz");

        assertFalse(custom.isDefault());
        assertNull(custom.getName());
        assertEquals(CreativeRole.of("xyz"), custom);
        assertEquals("xyz", custom.toString());
    }

    @Test
    void blankCodeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CreativeRole.of(" "));
    }

    @Test
    void defaultRolesCoverRelatorList() {
        assertThat(CreativeRole.getDefaultRoles())
                .hasSizeGreaterThan(200)
                .contains(CreativeRole.EDITOR, CreativeRole.ILLUSTRATOR)
                .allMatch(CreativeRole::isDefault);
    }
}
