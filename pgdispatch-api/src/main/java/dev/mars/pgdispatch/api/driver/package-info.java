/**
 * Native driver contract of the PgDispatch dispatcher.
 *
 * <p>The dispatcher never touches a database connection directly. It talks to a
 * {@link dev.mars.pgdispatch.api.driver.NativeDriver} and keeps the opaque handles it
 * hands back:</p>
 * <ul>
 *   <li>{@link dev.mars.pgdispatch.api.driver.ClientHandle} - an open connection</li>
 *   <li>{@link dev.mars.pgdispatch.api.driver.CursorHandle} - a paginated query</li>
 *   <li>{@link dev.mars.pgdispatch.api.driver.ListenChannelHandle} - the notification channel of a connection</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
package dev.mars.pgdispatch.api.driver;
