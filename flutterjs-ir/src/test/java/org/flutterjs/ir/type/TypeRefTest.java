package org.flutterjs.ir.type;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeRefTest {

    @Test
    void displayNameRendersArgumentsAndNullability() {
        TypeRef map = TypeRef.nullable("Map", TypeRef.of("String"), TypeRef.of("List", TypeRef.of("int")));

        assertThat(map.displayName()).isEqualTo("Map<String, List<int>>?");
        assertThat(TypeRef.of("State", TypeRef.of("Counter")).toString()).isEqualTo("State<Counter>");
    }

    @Test
    void asNullableKeepsTheOriginal() {
        TypeRef user = TypeRef.of("User");

        assertThat(user.asNullable().nullable()).isTrue();
        assertThat(user.nullable()).isFalse();
        assertThat(user.asNullable().asNullable()).isEqualTo(user.asNullable());
    }

    @Test
    void dynamicIncludesVar() {
        assertThat(TypeRef.DYNAMIC.isDynamic()).isTrue();
        assertThat(TypeRef.of("var").isDynamic()).isTrue();
        assertThat(TypeRef.VOID.isDynamic()).isFalse();
    }

    @Test
    void nameIsRequired() {
        assertThatThrownBy(() -> TypeRef.of(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
