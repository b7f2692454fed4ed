package tech.syncbridge.transform.path;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPathTest {

    @Test
    void shouldReadNestedKeysAndIndexes() {
        Map<String, Object> record = Map.of(
            "contacts", List.of(Map.of("email", "a@b.com"), Map.of("email", "c@d.com")),
            "matrix", List.of(List.of(1, 2), List.of(3, 4)));

        assertThat(FieldPath.read(record, "contacts[1].email")).isEqualTo("c@d.com");
        assertThat(FieldPath.read(record, "matrix[1][0]")).isEqualTo(3);
        assertThat(FieldPath.read(record, "contacts[5].email")).isNull();
        assertThat(FieldPath.read(record, "contacts.email")).isNull();
        assertThat(FieldPath.read(record, "missing.deep.path")).isNull();
    }

    @Test
    void shouldCreateIntermediateContainersOnWrite() {
        Map<String, Object> target = new LinkedHashMap<>();

        FieldPath.parse("a.b[2].c").set(target, "x");

        assertThat(FieldPath.read(target, "a.b[2].c")).isEqualTo("x");
        assertThat((List<?>) FieldPath.read(target, "a.b")).hasSize(3);
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> FieldPath.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldPath.parse("a..b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldPath.parse("a[x]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldPath.parse("a[1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldPath.parse("[0]")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareBySegments() {
        assertThat(FieldPath.parse("a.b[0]")).isEqualTo(FieldPath.parse("a.b[0]"));
        assertThat(FieldPath.parse("a.b[0]").rootKey()).isEqualTo("a");
    }
}
