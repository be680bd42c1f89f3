package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.TemplateCustomization;

/**
 * Receives the full customization snapshot after every applied change.
 */
@FunctionalInterface
public interface CustomizationListener {

    void onCustomizationChanged(TemplateCustomization customization);
}
