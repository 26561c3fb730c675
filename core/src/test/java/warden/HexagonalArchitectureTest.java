package warden;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("warden");
    }

    @Test
    @DisplayName("Core should not depend on adapters")
    void coreShouldNotDependOnAdapter() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("warden.core..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("warden.adapter..");

        rule.check(importedClasses);
    }

    @Test
    @DisplayName("Core should not depend on configuration wiring")
    void coreShouldNotDependOnWiring() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("warden.core..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("warden.config..");

        rule.check(importedClasses);
    }

    @Test
    @DisplayName("Core model should not depend on services")
    void modelShouldNotDependOnServices() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("warden.core.model..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("warden.core.service..");

        rule.check(importedClasses);
    }

    @Test
    @DisplayName("Model should not depend on the JWT library")
    void modelShouldNotDependOnJose4j() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("warden.core.model..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("org.jose4j..");

        rule.check(importedClasses);
    }
}
