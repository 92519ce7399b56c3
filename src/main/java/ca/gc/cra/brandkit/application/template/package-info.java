/** Template presets used to seed new brands. */
package ca.gc.cra.brandkit.application.template;
