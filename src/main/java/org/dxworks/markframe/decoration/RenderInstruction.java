package org.dxworks.markframe.decoration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * One decoration for the render host. Offsets are document offsets.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public sealed interface RenderInstruction {

    int from();

    int to();

    @JsonIgnore
    default boolean isLineLevel() {
        return false;
    }

    /** Style class and attributes applied to a whole line. */
    record LineAttribute(int lineFrom, int lineNumber, String styleClass, Map<String, String> attributes)
            implements RenderInstruction {
        public LineAttribute {
            attributes = Map.copyOf(attributes);
        }

        @Override
        public int from() {
            return lineFrom;
        }

        @Override
        public int to() {
            return lineFrom;
        }

        @JsonIgnore
        @Override
        public boolean isLineLevel() {
            return true;
        }
    }

    /** The span is not shown; the renderable is drawn instead. */
    record SpanReplace(int from, int to, Renderable renderable) implements RenderInstruction {
    }

    /** The span stays visible and gets a style class. */
    record SpanMark(int from, int to, String styleClass, Map<String, String> attributes) implements RenderInstruction {
        public SpanMark {
            attributes = Map.copyOf(attributes);
        }
    }

    /** A block widget drawn at {@code position}, usually above lines hidden by {@link LineAttribute}s. */
    record WidgetAnchor(int position, Renderable renderable) implements RenderInstruction {
        @Override
        public int from() {
            return position;
        }

        @Override
        public int to() {
            return position;
        }
    }
}
