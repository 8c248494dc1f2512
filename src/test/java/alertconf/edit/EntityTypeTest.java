package alertconf.edit;

import alertconf.rule.RuleValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityTypeTest {

    @Test
    void maps_type_names_to_sections() {
        assertThat(EntityType.fromString("alert").getSection()).isEqualTo("alerts");
        assertThat(EntityType.fromString("Notification")).isEqualTo(EntityType.NOTIFICATION);
        assertThat(EntityType.fromString("lookup").getSection()).isEqualTo("lookups");
    }

    @Test
    void rejects_unknown_type() {
        assertThatThrownBy(() -> EntityType.fromString("widget"))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("widget");
        assertThatThrownBy(() -> EntityType.fromString(null))
                .isInstanceOf(RuleValidationException.class);
    }
}
