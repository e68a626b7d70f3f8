package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.User;
import java.util.Optional;

public interface UserRepository {

    Optional<User> findById(long id);

    User updateName(long id, String name);

    User updateAvatar(long id, String avatar);
}
