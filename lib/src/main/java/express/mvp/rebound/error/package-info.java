/**
 * Structured errors and retry classification.
 *
 * <p>This package turns failures into retry decisions. Operations report failures as
 * {@link express.mvp.rebound.error.OperationException}s carrying a domain and a numeric code;
 * a classifier maps each (domain, code) pair to an {@link express.mvp.rebound.error.ErrorClass}.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.rebound.error.ErrorClass} - Retry eligibility of a failure
 *   <li>{@link express.mvp.rebound.error.ErrorDomain} - Family of the failing component
 *   <li>{@link express.mvp.rebound.error.OperationException} - Structured failure value
 *   <li>{@link express.mvp.rebound.error.ErrorClassifier} - Pure failure classification
 *   <li>{@link express.mvp.rebound.error.TableErrorClassifier} - Extensible lookup table
 *   <li>{@link express.mvp.rebound.error.ExceptionTranslator} - JDK exceptions to structured
 *       failures
 * </ul>
 *
 * @see express.mvp.rebound.RetryCoordinator
 */
package express.mvp.rebound.error;
