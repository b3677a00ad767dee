package io.github.cyfko.typemapper.fixtures.legacy;

import io.github.cyfko.typemapper.Mapper;
import io.github.cyfko.typemapper.fixtures.TestModels.User;
import io.github.cyfko.typemapper.fixtures.TestModels.UserDto;

import java.util.Locale;

/**
 * Shares its simple name with {@link io.github.cyfko.typemapper.fixtures.TestMappers.UserMapper}.
 */
public final class UserMapper implements Mapper<User, UserDto> {
    @Override
    public UserDto map(User source) {
        return new UserDto(source.lastName().toUpperCase(Locale.ROOT));
    }
}
