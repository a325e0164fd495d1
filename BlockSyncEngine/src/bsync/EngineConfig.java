package bsync;

import java.time.Clock;

import com.google.auto.value.AutoValue;

/** Collaborators injected into a {@link SyncEngine}. */
@AutoValue
public abstract class EngineConfig {
  public abstract IdGenerator idGenerator();

  /** Timestamps clipboards. */
  public abstract Clock clock();

  public static Builder builder() {
    return new AutoValue_EngineConfig.Builder()
        .setIdGenerator(IdGenerator.sequential())
        .setClock(Clock.systemUTC());
  }

  public static EngineConfig defaults() {
    return builder().build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIdGenerator(IdGenerator idGenerator);

    public abstract Builder setClock(Clock clock);

    public abstract EngineConfig build();
  }
}
