package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.model.Home;
import com.homestead.household.domain.model.HomeMembership;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.Room;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.port.out.BillRepository;
import com.homestead.household.domain.port.out.HomeRepository;
import com.homestead.household.domain.port.out.PollRepository;
import com.homestead.household.domain.port.out.RoomRepository;
import com.homestead.household.domain.port.out.ShoppingRepository;
import com.homestead.household.domain.port.out.TaskRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Homes and their memberships.
 * <p>
 * Deleting a home takes every home-scoped row with it, so the cached copies of all of
 * them are resolved and dropped up front.
 */
@Service
public class HomeService {

    private static final Logger logger = LoggerFactory.getLogger(HomeService.class);

    static final int INVITE_CODE_LENGTH = 8;
    private static final String INVITE_CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final HomeRepository homeRepository;
    private final TaskRepository taskRepository;
    private final RoomRepository roomRepository;
    private final PollRepository pollRepository;
    private final BillRepository billRepository;
    private final ShoppingRepository shoppingRepository;
    private final CacheAsideTemplate cacheAside;
    private final SecureRandom random = new SecureRandom();

    public HomeService(HomeRepository homeRepository,
                       TaskRepository taskRepository,
                       RoomRepository roomRepository,
                       PollRepository pollRepository,
                       BillRepository billRepository,
                       ShoppingRepository shoppingRepository,
                       CacheAsideTemplate cacheAside) {
        this.homeRepository = homeRepository;
        this.taskRepository = taskRepository;
        this.roomRepository = roomRepository;
        this.pollRepository = pollRepository;
        this.billRepository = billRepository;
        this.shoppingRepository = shoppingRepository;
        this.cacheAside = cacheAside;
    }

    /**
     * Creates a home with a fresh invite code. When a creator is given they join as admin.
     */
    public Home createHome(String name, Long creatorId) {
        String inviteCode = generateUniqueInviteCode();

        Home home = cacheAside.execute(CacheMutation
                .writing(() -> creatorId == null
                        ? homeRepository.create(name, inviteCode)
                        : homeRepository.createWithAdmin(name, inviteCode, creatorId))
                .publish(created -> DomainEvent.of(Module.HOME, Action.CREATED, created))
                .build());

        logger.info("Created home {} with invite code {}", home.id(), inviteCode);
        return home;
    }

    public Home getHome(long homeId) {
        return cacheAside.readThrough(CacheKeys.home(homeId), Home.class, () -> findHome(homeId));
    }

    public HomeMembership joinHome(String inviteCode, long userId) {
        Home home = homeRepository.findByInviteCode(inviteCode)
                .orElseThrow(() -> new BusinessRuleException("invalid invite code"));
        if (homeRepository.isMember(home.id(), userId)) {
            throw new BusinessRuleException("user is already a member of this home");
        }

        HomeMembership membership = cacheAside.execute(CacheMutation
                .writing(() -> homeRepository.addMember(home.id(), userId, HomeMembership.ROLE_MEMBER))
                .invalidate(CacheKeys.home(home.id()))
                .publish(joined -> DomainEvent.of(Module.HOME, Action.MEMBER_JOINED, joined))
                .build());

        logger.info("User {} joined home {}", userId, home.id());
        return membership;
    }

    public void leaveHome(long homeId, long userId) {
        cacheAside.execute(CacheMutation
                .running(() -> homeRepository.deleteMember(homeId, userId))
                .invalidate(CacheKeys.home(homeId))
                .publish(ignored -> DomainEvent.of(Module.HOME, Action.MEMBER_LEFT, memberRef(homeId, userId)))
                .build());

        logger.info("User {} left home {}", userId, homeId);
    }

    public void removeMember(long homeId, long userId, long actingUserId) {
        if (userId == actingUserId) {
            throw new BusinessRuleException("use leave to remove yourself from a home");
        }

        cacheAside.execute(CacheMutation
                .running(() -> homeRepository.deleteMember(homeId, userId))
                .invalidate(CacheKeys.home(homeId))
                .publish(ignored -> DomainEvent.of(Module.HOME, Action.MEMBER_REMOVED, memberRef(homeId, userId)))
                .build());

        logger.info("User {} removed user {} from home {}", actingUserId, userId, homeId);
    }

    public void deleteHome(long homeId) {
        Home home = findHome(homeId);

        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.home(homeId));
        keys.add(CacheKeys.tasksForHome(homeId));
        keys.add(CacheKeys.roomsForHome(homeId));
        keys.add(CacheKeys.pollsForHome(homeId));
        keys.add(CacheKeys.billCategoriesForHome(homeId));
        keys.add(CacheKeys.shoppingCategoriesForHome(homeId));
        keys.add(CacheKeys.notificationsForHome(homeId));

        List<Task> tasks = taskRepository.findByHomeId(homeId);
        for (Task task : tasks) {
            keys.add(CacheKeys.task(task.id()));
            taskRepository.findAssignmentsByTaskId(task.id())
                    .forEach(assignment -> keys.add(CacheKeys.assignment(assignment.id())));
        }
        for (Room room : roomRepository.findByHomeId(homeId)) {
            keys.add(CacheKeys.room(room.id()));
        }
        for (Poll poll : pollRepository.findByHomeId(homeId)) {
            keys.add(CacheKeys.poll(poll.id()));
        }
        for (Bill bill : billRepository.findByHomeId(homeId)) {
            keys.add(CacheKeys.bill(bill.id()));
        }
        for (ShoppingCategory category : shoppingRepository.findCategoriesByHomeId(homeId)) {
            keys.add(CacheKeys.shoppingCategory(category.id()));
        }
        for (Long memberId : home.memberIds()) {
            keys.add(CacheKeys.assignmentsForUser(memberId));
            keys.add(CacheKeys.closestAssignmentForUser(memberId));
        }

        cacheAside.execute(CacheMutation
                .running(() -> homeRepository.delete(homeId))
                .invalidate(keys)
                .publish(ignored -> DomainEvent.deleted(Module.HOME, homeId))
                .build());

        logger.info("Deleted home {} ({} tasks, {} members)", homeId, tasks.size(), home.memberships().size());
    }

    private Home findHome(long homeId) {
        return homeRepository.findById(homeId)
                .orElseThrow(() -> new EntityNotFoundException("home", homeId));
    }

    private String generateUniqueInviteCode() {
        String code;
        do {
            StringBuilder builder = new StringBuilder(INVITE_CODE_LENGTH);
            for (int i = 0; i < INVITE_CODE_LENGTH; i++) {
                builder.append(INVITE_CODE_ALPHABET.charAt(random.nextInt(INVITE_CODE_ALPHABET.length())));
            }
            code = builder.toString();
        } while (homeRepository.inviteCodeExists(code));
        return code;
    }

    private static Map<String, Long> memberRef(long homeId, long userId) {
        return Map.of("home_id", homeId, "user_id", userId);
    }
}
