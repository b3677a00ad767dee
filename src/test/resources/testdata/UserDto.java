package io.github.cyfko.example;

public record UserDto(String fullName) {
}
