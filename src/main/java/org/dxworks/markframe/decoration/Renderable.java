package org.dxworks.markframe.decoration;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.markframe.model.ElementPayload;

/**
 * Widget description handed to the render host: the widget type and the element data it renders.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Renderable(WidgetType widget, ElementPayload payload) {

    private static final Renderable HIDDEN = new Renderable(WidgetType.HIDDEN, null);

    public static Renderable hidden() {
        return HIDDEN;
    }
}
