package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.exception.SystemOfRecordException;
import com.homestead.household.domain.model.AssignmentStatus;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.model.Home;
import com.homestead.household.domain.model.HomeMembership;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.PollStatus;
import com.homestead.household.domain.model.Room;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.model.TaskAssignment;
import com.homestead.household.domain.port.out.BillRepository;
import com.homestead.household.domain.port.out.HomeRepository;
import com.homestead.household.domain.port.out.PollRepository;
import com.homestead.household.domain.port.out.RoomRepository;
import com.homestead.household.domain.port.out.ShoppingRepository;
import com.homestead.household.domain.port.out.TaskRepository;
import com.homestead.household.support.CacheFixtures;
import com.homestead.household.support.InMemoryCacheStore;
import com.homestead.household.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HomeServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");

    @Mock
    private HomeRepository homeRepository;
    @Mock
    private TaskRepository taskRepository;
    @Mock
    private RoomRepository roomRepository;
    @Mock
    private PollRepository pollRepository;
    @Mock
    private BillRepository billRepository;
    @Mock
    private ShoppingRepository shoppingRepository;

    private InMemoryCacheStore store;
    private RecordingEventPublisher publisher;
    private HomeService homeService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        publisher = new RecordingEventPublisher();
        homeService = new HomeService(homeRepository, taskRepository, roomRepository, pollRepository,
                billRepository, shoppingRepository, CacheFixtures.cacheAside(CacheFixtures.typedCache(store), publisher));
    }

    @Test
    void shouldCreateHomeWithUniqueEightCharacterInviteCode() {
        // Given
        when(homeRepository.inviteCodeExists(anyString())).thenReturn(true, false);
        when(homeRepository.create(eq("Flat 3B"), anyString()))
                .thenAnswer(invocation -> new Home(7L, "Flat 3B", invocation.getArgument(1), NOW, List.of()));

        // When
        Home home = homeService.createHome("Flat 3B", null);

        // Then
        ArgumentCaptor<String> codes = ArgumentCaptor.forClass(String.class);
        verify(homeRepository, times(2)).inviteCodeExists(codes.capture());
        assertThat(home.inviteCode()).hasSize(8).matches("[A-Z0-9]{8}").isEqualTo(codes.getAllValues().get(1));
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.HOME, Action.CREATED, home));
        verify(homeRepository, never()).addMember(anyLong(), anyLong(), anyString());
    }

    @Test
    void shouldMakeCreatorAdmin() {
        // Given
        HomeMembership admin = new HomeMembership(1L, 7L, 2L, HomeMembership.ROLE_ADMIN, NOW);
        Home withAdmin = new Home(7L, "Flat 3B", "ABCD1234", NOW, List.of(admin));
        when(homeRepository.inviteCodeExists(anyString())).thenReturn(false);
        when(homeRepository.createWithAdmin(eq("Flat 3B"), anyString(), eq(2L))).thenReturn(withAdmin);

        // When
        Home home = homeService.createHome("Flat 3B", 2L);

        // Then
        assertThat(home.memberIds()).containsExactly(2L);
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.HOME, Action.CREATED, withAdmin));
        verify(homeRepository, never()).create(anyString(), anyString());
        verify(homeRepository, never()).addMember(anyLong(), anyLong(), anyString());
    }

    @Test
    void shouldNotPublishWhenCreatorCannotJoin() {
        // Given
        when(homeRepository.inviteCodeExists(anyString())).thenReturn(false);
        when(homeRepository.createWithAdmin(eq("Flat 3B"), anyString(), eq(99L)))
                .thenThrow(new SystemOfRecordException("Failed while creating home with admin 99"));

        // When & Then
        assertThatThrownBy(() -> homeService.createHome("Flat 3B", 99L))
                .isInstanceOf(SystemOfRecordException.class);
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    void shouldRejectInvalidInviteCode() {
        when(homeRepository.findByInviteCode("NOPE0000")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> homeService.joinHome("NOPE0000", 2))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessage("invalid invite code");
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    void shouldRejectJoiningTwiceBeforeInvalidating() {
        // Given
        when(homeRepository.findByInviteCode("ABCD1234")).thenReturn(Optional.of(home()));
        when(homeRepository.isMember(7, 2)).thenReturn(true);
        store.put("home:7", "{}");

        // When & Then
        assertThatThrownBy(() -> homeService.joinHome("ABCD1234", 2))
                .isInstanceOf(BusinessRuleException.class);
        assertThat(store.contains("home:7")).isTrue();
    }

    @Test
    void shouldInvalidateHomeWhenMemberJoins() {
        // Given
        HomeMembership membership = new HomeMembership(5L, 7L, 3L, HomeMembership.ROLE_MEMBER, NOW);
        when(homeRepository.findByInviteCode("ABCD1234")).thenReturn(Optional.of(home()));
        when(homeRepository.isMember(7, 3)).thenReturn(false);
        when(homeRepository.addMember(7, 3, HomeMembership.ROLE_MEMBER)).thenReturn(membership);
        store.put("home:7", "{}");

        // When
        homeService.joinHome("ABCD1234", 3);

        // Then
        assertThat(store.contains("home:7")).isFalse();
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.HOME, Action.MEMBER_JOINED, membership));
    }

    @Test
    void shouldPublishMemberReferenceOnLeave() {
        homeService.leaveHome(7, 2);

        verify(homeRepository).deleteMember(7, 2);
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.HOME, Action.MEMBER_LEFT,
                Map.of("home_id", 7L, "user_id", 2L)));
    }

    @Test
    void shouldRejectSelfRemoval() {
        assertThatThrownBy(() -> homeService.removeMember(7, 2, 2))
                .isInstanceOf(BusinessRuleException.class);
        verify(homeRepository, never()).deleteMember(anyLong(), anyLong());
    }

    @Test
    void shouldRemoveOtherMember() {
        homeService.removeMember(7, 3, 2);

        verify(homeRepository).deleteMember(7, 3);
        assertThat(publisher.single().action()).isEqualTo(Action.MEMBER_REMOVED);
    }

    @Test
    void shouldInvalidateEveryHomeScopedKeyOnDelete() {
        // Given
        when(homeRepository.findById(7)).thenReturn(Optional.of(home()));
        when(taskRepository.findByHomeId(7)).thenReturn(List.of(new Task(10L, 7L, null, "Dishes", null, "daily", NOW)));
        when(taskRepository.findAssignmentsByTaskId(10)).thenReturn(List.of(
                new TaskAssignment(3L, 10L, 7L, 2L, AssignmentStatus.ASSIGNED, LocalDate.of(2025, 1, 12), null)));
        when(roomRepository.findByHomeId(7)).thenReturn(List.of(new Room(4L, 7L, "Kitchen", NOW)));
        when(pollRepository.findByHomeId(7)).thenReturn(List.of(
                new Poll(9L, 7L, "Pizza?", "single", PollStatus.OPEN, false, null, NOW, List.of())));
        when(billRepository.findByHomeId(7)).thenReturn(List.of(new Bill(42L, 7L, null, "water", false, null,
                BigDecimal.TEN, null, null, 2L, null, NOW)));
        when(shoppingRepository.findCategoriesByHomeId(7)).thenReturn(List.of(
                new ShoppingCategory(5L, 7L, "Groceries", null, ShoppingCategory.DEFAULT_COLOR, NOW, List.of())));

        List<String> keys = List.of("home:7", "home:7:tasks", "home:7:rooms", "home:7:polls", "home:7:bill-categories",
                "home:7:shopping-categories", "home:7:notifications", "task:10", "assignment:3", "room:4", "poll:9",
                "bill:42", "shopping-category:5", "user:2:assignments", "user:2:closest-assignment");
        keys.forEach(key -> store.put(key, "{}"));

        // When
        homeService.deleteHome(7);

        // Then
        assertThat(keys).noneMatch(store::contains);
        verify(homeRepository).delete(7);
        assertThat(publisher.single()).isEqualTo(DomainEvent.deleted(Module.HOME, 7));
    }

    private static Home home() {
        return new Home(7L, "Flat 3B", "ABCD1234", NOW,
                List.of(new HomeMembership(1L, 7L, 2L, HomeMembership.ROLE_ADMIN, NOW)));
    }
}
