package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.Home;
import com.homestead.household.domain.model.HomeMembership;
import java.util.Optional;

/**
 * Repository port for homes and their memberships.
 */
public interface HomeRepository {

    Home create(String name, String inviteCode);

    /**
     * Creates the home and its admin membership atomically.
     *
     * @return the home with its single membership loaded
     */
    Home createWithAdmin(String name, String inviteCode, long adminUserId);

    /**
     * Loads a home together with its memberships.
     */
    Optional<Home> findById(long id);

    Optional<Home> findByInviteCode(String inviteCode);

    boolean inviteCodeExists(String inviteCode);

    boolean isMember(long homeId, long userId);

    HomeMembership addMember(long homeId, long userId, String role);

    /**
     * @throws com.homestead.household.domain.exception.EntityNotFoundException if the user is not a member
     */
    void deleteMember(long homeId, long userId);

    /**
     * Deletes the home. Everything scoped to it goes with it.
     */
    void delete(long id);
}
