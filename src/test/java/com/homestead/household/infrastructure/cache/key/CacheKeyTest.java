package com.homestead.household.infrastructure.cache.key;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyTest {

    @Test
    void shouldRenderEntityKeys() {
        assertThat(CacheKeys.home(7).value()).isEqualTo("home:7");
        assertThat(CacheKeys.task(10).value()).isEqualTo("task:10");
        assertThat(CacheKeys.assignment(3).value()).isEqualTo("assignment:3");
        assertThat(CacheKeys.room(4).value()).isEqualTo("room:4");
        assertThat(CacheKeys.bill(42).value()).isEqualTo("bill:42");
        assertThat(CacheKeys.poll(9).value()).isEqualTo("poll:9");
        assertThat(CacheKeys.shoppingCategory(5).value()).isEqualTo("shopping-category:5");
    }

    @Test
    void shouldRenderRelationKeys() {
        assertThat(CacheKeys.tasksForHome(7).value()).isEqualTo("home:7:tasks");
        assertThat(CacheKeys.roomsForHome(7).value()).isEqualTo("home:7:rooms");
        assertThat(CacheKeys.pollsForHome(7).value()).isEqualTo("home:7:polls");
        assertThat(CacheKeys.billCategoriesForHome(7).value()).isEqualTo("home:7:bill-categories");
        assertThat(CacheKeys.shoppingCategoriesForHome(7).value()).isEqualTo("home:7:shopping-categories");
        assertThat(CacheKeys.notificationsForHome(7).value()).isEqualTo("home:7:notifications");
        assertThat(CacheKeys.assignmentsForUser(2).value()).isEqualTo("user:2:assignments");
        assertThat(CacheKeys.closestAssignmentForUser(2).value()).isEqualTo("user:2:closest-assignment");
        assertThat(CacheKeys.notificationsForUser(2).value()).isEqualTo("user:2:notifications");
    }

    @Test
    void shouldBeDeterministic() {
        assertThat(CacheKeys.task(10)).isEqualTo(CacheKeys.task(10));
        assertThat(CacheKeys.task(10).value()).isEqualTo(CacheKeys.task(10).value());
        assertThat(CacheKeys.task(10)).hasToString("task:10");
    }

    @Test
    void shouldKeepEntityAndListKeysOfSameHomeApart() {
        assertThat(CacheKeys.home(7).value()).isNotEqualTo(CacheKeys.tasksForHome(7).value());
        assertThat(CacheKeys.tasksForHome(7).value()).isNotEqualTo(CacheKeys.roomsForHome(7).value());
    }

    @Test
    void shouldNotShareSegmentAndRelationBetweenKinds() {
        Set<String> shapes = new HashSet<>();

        for (CacheKind kind : CacheKind.values()) {
            assertThat(shapes.add(kind.segment() + "|" + kind.relation()))
                    .as("shape of %s", kind)
                    .isTrue();
        }
    }

    @Test
    void shouldNeverUseSeparatorInsideSegmentsOrRelations() {
        assertThat(Arrays.stream(CacheKind.values()))
                .allSatisfy(kind -> {
                    assertThat(kind.segment()).doesNotContain(":");
                    if (kind.relation() != null) {
                        assertThat(kind.relation()).doesNotContain(":");
                    }
                });
    }

    @Test
    void shouldRejectMissingKind() {
        assertThatThrownBy(() -> CacheKey.of(null, 1))
                .isInstanceOf(NullPointerException.class);
    }
}
