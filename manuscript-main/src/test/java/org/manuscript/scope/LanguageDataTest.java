package org.manuscript.scope;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageDataTest {

    @Test
    void standardTable_isLoadedOnceAndShared() {
        assertThat(LanguageData.standard()).isSameAs(LanguageData.standard());
    }

    @Test
    void standardTable_knowsCoreNames() {
        LanguageData data = LanguageData.standard();

        assertThat(data.isGlobal("Sibelius")).isTrue();
        assertThat(data.isGlobal("Crotchet")).isTrue();
        assertThat(data.isGlobal("AddToPluginsMenu")).isTrue();
        assertThat(data.isGlobal("myLocal")).isFalse();
        assertThat(data.signature("AddToPluginsMenu")).contains(List.of(new Arity(2, 2)));
        assertThat(data.signature("SetTimeSignature")).hasValueSatisfying(
                overloads -> assertThat(Arity.describe(overloads)).isEqualTo("1 or 3-4"));
        assertThat(data.signature("NoSuchCall")).isEmpty();
    }

    @Test
    void arity_validatesAndRenders() {
        assertThat(new Arity(1, 3).accepts(3)).isTrue();
        assertThat(new Arity(1, 3).accepts(0)).isFalse();
        assertThat(new Arity(2, 2)).hasToString("2");
        assertThatThrownBy(() -> new Arity(3, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void standardTable_knowsHostObjectMembers() {
        LanguageData data = LanguageData.standard();

        assertThat(data.objectApi("Sibelius")).hasValueSatisfying(api -> {
            assertThat(api.hasMethod("CreateTextFile")).isTrue();
            assertThat(api.hasMethod("WriteTextFile")).isFalse();
            assertThat(api.hasMember("ActiveScore")).isTrue();
            assertThat(api.hasMember("MessageBox")).isTrue();
        });
        assertThat(data.objectApi("Staff")).isEmpty();
        assertThat(data.isCallable("Chr")).isTrue();
        assertThat(data.isCallable("Sibelius")).isTrue();
        assertThat(data.isCallable("Crotchet")).isFalse();
    }

    @Test
    void customTable_isImmutable() {
        LanguageData data = new LanguageData(Set.of("Host"), Set.of(), Set.of(),
                Map.of("Go", List.of(new Arity(0, 1))), Map.of());

        assertThat(data.globals()).containsExactly("Host");
        assertThatThrownBy(() -> data.globals().add("Other")).isInstanceOf(UnsupportedOperationException.class);
    }

    // ── Object members ──────────────────────────────────────────

    @Test
    void objectApi_suggestsCaseInsensitiveThenNearest() {
        ObjectApi api = new ObjectApi(Set.of("MessageBox"), Set.of("ActiveScore", "ScoreCount"));

        assertThat(api.suggest("activescore")).contains("ActiveScore");
        assertThat(api.suggest("ActiveScor")).contains("ActiveScore");
        assertThat(api.suggest("MesageBox")).contains("MessageBox");
        assertThat(api.suggest("Xyz123")).isEmpty();
    }

    @Test
    void objectApi_distanceCountsSingleEdits() {
        assertThat(ObjectApi.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(ObjectApi.distance("", "abc")).isEqualTo(3);
        assertThat(ObjectApi.distance("same", "same")).isZero();
    }
}
