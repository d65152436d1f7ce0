package org.pnml2fast.io;

import org.apache.axiom.om.OMElement;
import org.apache.axiom.om.OMException;
import org.apache.axiom.om.OMXMLBuilderFactory;
import org.apache.axiom.om.OMXMLParserWrapper;
import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 从 PNML 文档读取 P/T 网。
 * <p>
 * 元素只按本地名匹配，命名空间前缀与 URI 一律忽略，
 * 因此带或不带 {@code xmlns="http://www.pnml.org/version-2009/grammar/pnml"} 的文档得到相同的网。
 * 读取的字段：
 * <ul>
 *     <li>网名：第一个 net 元素的 name/text，缺失时为空串；</li>
 *     <li>net 下所有 place (跨 page，按文档顺序)：@id、name/text、initialMarking/text；</li>
 *     <li>所有 transition：@id、name/text；</li>
 *     <li>所有 arc：@id、@source、@target、inscription/text。</li>
 * </ul>
 */
public class PnmlReader {

    private static final Logger logger = LoggerFactory.getLogger(PnmlReader.class);

    private static final QName ID = new QName("id");
    private static final QName SOURCE = new QName("source");
    private static final QName TARGET = new QName("target");

    public PetriNet read(Path file) throws IOException {
        logger.info("读取 PNML 文件: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public PetriNet read(InputStream in) {
        Objects.requireNonNull(in, "Input stream cannot be null");
        OMXMLParserWrapper builder = null;
        try {
            builder = OMXMLBuilderFactory.createOMBuilder(in);
            OMElement root = builder.getDocumentElement();
            return readNet(findNet(root));
        } catch (OMException e) {
            throw new PnmlFormatException("无法解析 PNML 文档: " + e.getMessage(), e);
        } finally {
            if (builder != null) {
                builder.close();
            }
        }
    }

    private OMElement findNet(OMElement root) {
        for (Iterator<?> it = root.getDescendants(true); it.hasNext(); ) {
            Object next = it.next();
            if (next instanceof OMElement && isElement((OMElement) next, "net")) {
                return (OMElement) next;
            }
        }
        throw new PnmlFormatException("PNML 文档中没有 net 元素");
    }

    private PetriNet readNet(OMElement net) {
        String netName = labelText(net, "name");
        if (netName.isEmpty()) {
            logger.warn("net 元素没有名称，model 名将为空。");
        }

        List<Place> places = new ArrayList<>();
        List<Transition> transitions = new ArrayList<>();
        List<Arc> arcs = new ArrayList<>();

        // 网本身的 name 标签也是后代，但不会以 place/transition/arc 为本地名
        for (Iterator<?> it = net.getDescendants(false); it.hasNext(); ) {
            Object next = it.next();
            if (!(next instanceof OMElement)) {
                continue;
            }
            OMElement elem = (OMElement) next;
            if (isElement(elem, "place")) {
                places.add(readPlace(elem));
            } else if (isElement(elem, "transition")) {
                transitions.add(readTransition(elem));
            } else if (isElement(elem, "arc")) {
                arcs.add(readArc(elem));
            }
        }

        PetriNet petriNet = new PetriNet(netName, places, transitions, arcs);
        reportUnmatchedArcs(petriNet);
        return petriNet;
    }

    private Place readPlace(OMElement elem) {
        String id = requiredAttribute(elem, ID);
        String name = labelText(elem, "name");
        if (name.isEmpty()) {
            logger.warn("库所 '{}' 没有名称。", id);
        }
        try {
            return Place.of(id, name, Place.initialMarking(labelText(elem, "initialMarking")));
        } catch (IllegalArgumentException e) {
            throw new PnmlFormatException("库所 '" + id + "' 的初始标识无效: " + e.getMessage(), e);
        }
    }

    private Transition readTransition(OMElement elem) {
        String id = requiredAttribute(elem, ID);
        String name = labelText(elem, "name");
        if (name.isEmpty()) {
            logger.warn("变迁 '{}' 没有名称。", id);
        }
        return Transition.of(id, name);
    }

    private Arc readArc(OMElement elem) {
        String id = requiredAttribute(elem, ID);
        String source = requiredAttribute(elem, SOURCE);
        String target = requiredAttribute(elem, TARGET);
        try {
            return Arc.of(id, source, target, Arc.arcWeight(labelText(elem, "inscription")));
        } catch (IllegalArgumentException e) {
            throw new PnmlFormatException("弧 '" + id + "' 的权重无效: " + e.getMessage(), e);
        }
    }

    /**
     * 悬空弧与同类节点之间的弧不会被任何 (库所, 变迁) 查询匹配，这里只记录下来。
     */
    private void reportUnmatchedArcs(PetriNet net) {
        for (Arc arc : net.getArcs()) {
            boolean placeToTransition = net.findPlace(arc.getSource()).isPresent()
                    && net.findTransition(arc.getTarget()).isPresent();
            boolean transitionToPlace = net.findTransition(arc.getSource()).isPresent()
                    && net.findPlace(arc.getTarget()).isPresent();
            if (!placeToTransition && !transitionToPlace) {
                logger.warn("弧 '{}' ({}) 不连接一个库所和一个变迁，翻译时将被忽略。", arc.getId(), arc);
            }
        }
    }

    /**
     * 命名空间归一化的唯一入口：只比较本地名。
     */
    private static boolean isElement(OMElement elem, String localName) {
        return localName.equals(elem.getLocalName());
    }

    private static OMElement firstChild(OMElement parent, String localName) {
        for (Iterator<?> it = parent.getChildElements(); it.hasNext(); ) {
            OMElement child = (OMElement) it.next();
            if (isElement(child, localName)) {
                return child;
            }
        }
        return null;
    }

    /**
     * PNML 标签的文本，形如 &lt;label&gt;&lt;text&gt;value&lt;/text&gt;&lt;/label&gt;。
     * @return 去掉首尾空白的文本；标签或 text 缺失时为空串。
     */
    private static String labelText(OMElement parent, String label) {
        OMElement labelElem = firstChild(parent, label);
        if (labelElem == null) {
            return "";
        }
        OMElement text = firstChild(labelElem, "text");
        if (text == null) {
            return "";
        }
        return text.getText().trim();
    }

    private static String requiredAttribute(OMElement elem, QName attribute) {
        String value = elem.getAttributeValue(attribute);
        if (value == null || value.isEmpty()) {
            throw new PnmlFormatException(String.format("%s 元素缺少 %s 属性", elem.getLocalName(), attribute.getLocalPart()));
        }
        return value;
    }
}
