/**
 * Value types exchanged between the cleanup engine, its database collaborator and
 * its listeners.
 *
 * @see dbcleaner.model.Row
 * @see dbcleaner.model.TableCleanupResult
 * @see dbcleaner.model.CleanupReport
 */
package dbcleaner.model;
