package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Module dependency enforcement.
 *
 * <pre>
 * module-app      (orchestration, stages, agents, REST, Spring wiring)
 *     ↓ depends on
 * module-infra    (executor, circuit breakers, message bus and transports)
 *     ↓ depends on
 * module-core     (domain model, consensus engine, ports)
 *     ↓ depends on
 * module-common   (error codes and exceptions)
 * </pre>
 */
@DisplayName("Module Dependency Enforcement")
class ModuleDependencyTest {

  private static final String[] APP_PACKAGES = {
    "incident.commander.agent..",
    "incident.commander.config..",
    "incident.commander.controller..",
    "incident.commander.global..",
    "incident.commander.lifecycle..",
    "incident.commander.notification..",
    "incident.commander.orchestration.."
  };

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("incident.commander");

  @Nested
  @DisplayName("Dependency Direction: app → infra → core → common")
  class DependencyDirectionTests {

    @Test
    @DisplayName("module-infra does not depend on the application layer")
    void infraDoesNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(APP_PACKAGES)
          .because("transports and breakers are reused by every stage; they know nothing of stages")
          .check(classes);
    }

    @Test
    @DisplayName("module-core depends on common only")
    void coreDependsOnCommonOnly() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.core..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("incident.commander.infrastructure..")
          .orShould()
          .dependOnClassesThat()
          .resideInAnyPackage(APP_PACKAGES)
          .check(classes);
    }

    @Test
    @DisplayName("module-common depends on nothing above it")
    void commonIsALeaf() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.error..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("incident.commander.core..", "incident.commander.infrastructure..")
          .orShould()
          .dependOnClassesThat()
          .resideInAnyPackage(APP_PACKAGES)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Framework isolation")
  class FrameworkIsolationTests {

    @Test
    @DisplayName("the domain and consensus engine are free of Spring and logging")
    void coreIsFrameworkFree() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.springframework..", "org.slf4j..", "org.redisson..")
          .check(classes);
    }

    @Test
    @DisplayName("agents do not talk to the message bus directly")
    void agentsStayOffTheBus() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.agent..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("incident.commander.infrastructure.messaging..")
          .because("stages own messaging side effects")
          .check(classes);
    }

    @Test
    @DisplayName("controllers go through the graph, not individual stages")
    void controllersUseTheGraph() {
      noClasses()
          .that()
          .resideInAPackage("incident.commander.controller..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("incident.commander.orchestration.stage..")
          .check(classes);
    }
  }
}
