/**
 * Spring transaction integration: {@link courier.spring.SpringTxContext} defers dispatches to
 * after commit.
 */
package courier.spring;
