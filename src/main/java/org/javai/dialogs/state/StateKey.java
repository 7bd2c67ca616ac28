package org.javai.dialogs.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed handle for one entry of a state record.
 *
 * <p>A key carries its value type and the default policy applied on first access,
 * so every reader of the key agrees on what an absent value materializes to.</p>
 *
 * <pre>{@code
 * static final StateKey<List<String>> TITLES =
 *         StateKey.of("reminderTitles", new TypeReference<>() {}, ArrayList::new);
 * }</pre>
 *
 * @param <T> the value type
 */
public final class StateKey<T> {

	private final String name;
	private final JavaType type;
	private final Supplier<T> defaultValue;

	private StateKey(String name, JavaType type, Supplier<T> defaultValue) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		this.name = name;
		this.type = Objects.requireNonNull(type, "type must not be null");
		this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must not be null");
	}

	public static <T> StateKey<T> of(String name, Class<T> type, Supplier<T> defaultValue) {
		return new StateKey<>(name, TypeFactory.defaultInstance().constructType(type), defaultValue);
	}

	public static <T> StateKey<T> of(String name, TypeReference<T> type, Supplier<T> defaultValue) {
		return new StateKey<>(name, TypeFactory.defaultInstance().constructType(type), defaultValue);
	}

	public String name() {
		return name;
	}

	JavaType type() {
		return type;
	}

	/**
	 * Creates a fresh default value for this key.
	 *
	 * @throws IllegalStateException if the default factory returns {@code null}
	 */
	public T newDefault() {
		T value = defaultValue.get();
		if (value == null) {
			throw new IllegalStateException("Default factory for state key '" + name + "' returned null");
		}
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StateKey<?> other)) {
			return false;
		}
		return name.equals(other.name) && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public String toString() {
		return "StateKey[" + name + ": " + type.toCanonical() + "]";
	}
}
