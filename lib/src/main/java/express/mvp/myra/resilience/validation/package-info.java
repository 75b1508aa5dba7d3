/** Parameter validation raising {@code VALIDATION} errors. */
package express.mvp.myra.resilience.validation;
