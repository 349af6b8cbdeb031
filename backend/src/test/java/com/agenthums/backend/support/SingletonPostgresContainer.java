package com.agenthums.backend.support;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

public final class SingletonPostgresContainer
    extends PostgreSQLContainer<SingletonPostgresContainer> {

  private static final DockerImageName IMAGE = DockerImageName.parse("postgres:16-alpine");

  private static SingletonPostgresContainer container;

  private SingletonPostgresContainer() {
    super(IMAGE);
    withDatabaseName("agent_hums_test");
    withUsername("agent_hums");
    withPassword("agent_hums");
    withReuse(true);
  }

  public static synchronized SingletonPostgresContainer getInstance() {
    if (container == null) {
      container = new SingletonPostgresContainer();
      container.start();
    }
    return container;
  }
}
