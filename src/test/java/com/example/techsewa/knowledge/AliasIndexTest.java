package com.example.techsewa.knowledge;

import com.example.techsewa.lang.Languages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AliasIndexTest {

    private static ProblemRecord record(String id, String... aliases) {
        return ProblemRecord.builder()
                .id(id)
                .alias(Languages.EN, List.of(aliases))
                .answer(Languages.EN, "answer " + id)
                .build();
    }

    @Test
    void keysAreLowercasedAndStripped() {
        AliasIndex index = AliasIndex.build(List.of(record("a", "  WiFi Not Working ")));

        assertThat(index.exact(Languages.EN, "wifi not working")).isPresent();
        assertThat(index.size(Languages.EN)).isEqualTo(1);
    }

    @Test
    void laterRecordWinsCollisionButKeepsPosition() {
        AliasIndex index = AliasIndex.build(List.of(
                record("a", "slow", "hot"),
                record("b", "slow")));

        assertThat(index.entries(Languages.EN).keySet()).containsExactly("slow", "hot");
        assertThat(index.exact(Languages.EN, "slow")).map(ProblemRecord::getId).contains("b");
    }

    @Test
    void unknownLanguageIsEmpty() {
        AliasIndex index = AliasIndex.build(List.of(record("a", "slow")));

        assertThat(index.entries("fr")).isEmpty();
        assertThat(index.exact(Languages.NP, "slow")).isEmpty();
    }
}
