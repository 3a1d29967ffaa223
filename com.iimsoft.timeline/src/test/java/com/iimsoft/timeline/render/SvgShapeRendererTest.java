package com.iimsoft.timeline.render;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SvgShapeRendererTest {

    private final SvgShapeRenderer renderer = new SvgShapeRenderer();

    private static Map<String, Object> attrs(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    @Test
    void rootIsSvg() {
        assertThat(renderer.getRoot().getKind()).isEqualTo("svg");
        assertThat(renderer.hasClass(renderer.getRoot(), "gantt")).isTrue();
    }

    @Test
    void boundingBoxOfGroupIsUnionOfChildren() {
        ShapeHandle group = renderer.createShape("g", attrs(), null);
        renderer.createShape("rect", attrs("x", 10, "y", 20, "width", 30, "height", 5), group);
        renderer.createShape("rect", attrs("x", 50.0, "y", 0.0, "width", 10.0, "height", 10.0), group);

        BoundingBox box = renderer.getBoundingBox(group);

        assertThat(box.getX()).isEqualTo(10);
        assertThat(box.getY()).isEqualTo(0);
        assertThat(box.getX2()).isEqualTo(60);
        assertThat(box.getY2()).isEqualTo(25);
    }

    @Test
    void textWidthIsEstimatedFromLength() {
        Map<String, Object> a = attrs("x", 0, "y", 20);
        a.put(ShapeRenderer.TEXT, "abcd");
        ShapeHandle text = renderer.createShape("text", a, null);

        assertThat(renderer.getBoundingBox(text).getWidth()).isEqualTo(4 * SvgShapeRenderer.CHAR_WIDTH);
    }

    @Test
    void classHelpersEditClassAttribute() {
        ShapeHandle rect = renderer.createShape("rect", attrs("class", "bar"), null);

        renderer.addClass(rect, "active");
        renderer.addClass(rect, "active");
        assertThat(renderer.getAttribute(rect, "class")).isEqualTo("bar active");

        renderer.removeClass(rect, "bar");
        assertThat(renderer.getAttribute(rect, "class")).isEqualTo("active");
        assertThat(renderer.findByClass("active")).containsExactly(rect);
    }

    @Test
    void dispatchGoesToClosestListeningAncestor() {
        List<String> calls = new ArrayList<>();
        ShapeHandle outer = renderer.createShape("g", attrs(), null);
        ShapeHandle inner = renderer.createShape("g", attrs(), outer);
        ShapeHandle rect = renderer.createShape("rect", attrs(), inner);
        renderer.listen(outer, Gesture.PRESS, (e, t) -> calls.add("outer"));
        renderer.listen(inner, Gesture.PRESS, (e, t) -> calls.add("inner"));

        assertThat(renderer.dispatch(rect, Gesture.PRESS, new PointerEvent(1, 2))).isTrue();
        assertThat(calls).containsExactly("inner");
        assertThat(renderer.dispatch(rect, Gesture.CLICK, new PointerEvent(1, 2))).isFalse();
    }

    @Test
    void clearKeepsRootListeners() {
        List<String> calls = new ArrayList<>();
        renderer.listen(renderer.getRoot(), Gesture.MOVE, (e, t) -> calls.add("move"));
        renderer.createShape("rect", attrs(), null);

        renderer.clear();

        assertThat(renderer.getChildren(renderer.getRoot())).isEmpty();
        renderer.dispatch(renderer.getRoot(), Gesture.MOVE, new PointerEvent(0, 0));
        assertThat(calls).containsExactly("move");
    }

    @Test
    void removeDetachesShape() {
        ShapeHandle group = renderer.createShape("g", attrs(), null);
        ShapeHandle rect = renderer.createShape("rect", attrs(), group);

        renderer.remove(rect);

        assertThat(renderer.getChildren(group)).isEmpty();
        assertThat(renderer.getParent(group)).isSameAs(renderer.getRoot());
        assertThatThrownBy(() -> renderer.remove(renderer.getRoot())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toSvgEscapesAndTrimsWholeNumbers() {
        Map<String, Object> a = attrs("x", 12.0, "y", 3.5, "class", "bar-label");
        a.put(ShapeRenderer.TEXT, "R&D <phase>");
        renderer.createShape("text", a, null);

        String svg = renderer.toSvg();

        assertThat(svg).startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" class=\"gantt\">");
        assertThat(svg).contains("<text x=\"12\" y=\"3.5\" class=\"bar-label\">R&amp;D &lt;phase&gt;</text>");
    }

    @Test
    void foreignHandleIsRejected() {
        ShapeHandle foreign = () -> "rect";

        assertThatThrownBy(() -> renderer.setAttribute(foreign, "x", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not belong");
    }
}
