package org.springaicommunity.github.commitwatch;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link RepositoryClient} - Upstream commits and branches</li>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link CursorStore}, {@link SubscriptionIndex} - Persistence operations</li>
 * <li>{@link NotificationSink} - Chat transport</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Check cycle (checker, scheduler, dispatcher, service) → Interfaces
 *   Decorators → Interface they decorate
 *   Builder / Spring config → Concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.commitwatch",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule check_cycle_should_not_depend_on_concrete_stores = noClasses().that()
		.haveSimpleNameEndingWith("Checker")
		.or()
		.haveSimpleNameEndingWith("Scheduler")
		.or()
		.haveSimpleNameEndingWith("Dispatcher")
		.or()
		.haveSimpleName("CommitWatchService")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("FileSystem")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("InMemory")
		.because("The check cycle should depend on CursorStore and SubscriptionIndex, not their implementations");

	@ArchTest
	static final ArchRule check_cycle_should_not_depend_on_http_clients = noClasses().that()
		.haveSimpleNameEndingWith("Checker")
		.or()
		.haveSimpleNameEndingWith("Scheduler")
		.or()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRepositoryClient")
		.because("The check cycle should depend on the RepositoryClient interface");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule cursor_stores_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("CursorStore")
		.and()
		.doNotHaveSimpleName("CursorStore")
		.should()
		.implement(CursorStore.class)
		.because("All *CursorStore classes should implement the CursorStore interface");

	@ArchTest
	static final ArchRule subscription_indexes_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("SubscriptionIndex")
		.and()
		.doNotHaveSimpleName("SubscriptionIndex")
		.should()
		.implement(SubscriptionIndex.class)
		.because("All *SubscriptionIndex classes should implement the SubscriptionIndex interface");

	@ArchTest
	static final ArchRule repository_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("RepositoryClient")
		.and()
		.doNotHaveSimpleName("RepositoryClient")
		.should()
		.implement(RepositoryClient.class)
		.because("All *RepositoryClient classes should implement the RepositoryClient interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Status")
		.or()
		.haveSimpleNameEndingWith("Stats")
		.or()
		.haveSimpleNameEndingWith("Info")
		.or()
		.haveSimpleNameEndingWith("Listing")
		.or()
		.haveSimpleName("Cursor")
		.or()
		.haveSimpleName("CommitRef")
		.or()
		.haveSimpleName("RepositoryId")
		.or()
		.haveSimpleName("Notification")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Scheduler")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule change_detection_should_be_free_of_io = noClasses().that()
		.haveSimpleName("ChangeDetector")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Store")
		.because("Change detection is a pure function of cursor and listing");

	// ========== Support Rules ==========

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Support")
		.or()
		.haveSimpleNameEndingWith("Factory")
		.or()
		.haveSimpleName("JsonStateFile")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support/utility classes should not depend on higher-level services");

}
