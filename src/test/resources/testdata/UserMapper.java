package io.github.cyfko.example;

import io.github.cyfko.typemapper.IndexedMapper;
import io.github.cyfko.typemapper.Mapper;

@IndexedMapper
public class UserMapper implements Mapper<User, UserDto> {

    @Override
    public UserDto map(User source) {
        return new UserDto(source.getFirstName() + " " + source.getLastName());
    }
}
