package com.atfengine.parse;

import com.atfengine.config.Constants;
import com.atfengine.config.ParserConfig;
import com.atfengine.document.Column;
import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Header;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;
import com.atfengine.line.ClassifiedLine;
import com.atfengine.line.LineClassifier;
import com.atfengine.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 逐行驱动分类器并组装文档树。
 *
 * <p>维护“当前表面”“当前栏”两个游标；内容先于任何声明出现时自动创建默认表面与隐式栏。
 * 每个实例只服务一次解析，{@link #build()} 之后不可再追加行。
 */
public class DocumentBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DocumentBuilder.class);

    private final LineClassifier classifier;
    private final WordTokenizer tokenizer;
    private final String defaultSurfaceName;

    private String catalogId;
    private String title;
    private String language;
    private String objectType;
    private final List<SurfaceDraft> surfaces = new ArrayList<>();
    private final List<CompositeRef> compositeRefs = new ArrayList<>();

    private Integer currentSurface;
    private Integer currentColumn;
    private boolean built;

    public DocumentBuilder() {
        this(ParserConfig.defaults(), new LineClassifier(), new WordTokenizer());
    }

    public DocumentBuilder(ParserConfig config, LineClassifier classifier, WordTokenizer tokenizer) {
        if (config == null || classifier == null || tokenizer == null) {
            throw new IllegalArgumentException("配置、分类器与分词器均不能为空");
        }
        this.classifier = classifier;
        this.tokenizer = tokenizer;
        this.defaultSurfaceName = config.getDefaultSurfaceName();
        this.objectType = config.getDefaultObjectType();
    }

    /**
     * 依次处理多行文本，空行忽略。
     */
    public DocumentBuilder acceptAll(String text) {
        if (text == null || text.isEmpty()) {
            return this;
        }
        text.lines().forEach(this::accept);
        return this;
    }

    /**
     * 处理一行原始文本。
     */
    public DocumentBuilder accept(String rawLine) {
        if (built) {
            throw new IllegalStateException("文档已构建，不能继续追加行");
        }
        if (rawLine == null || rawLine.isBlank()) {
            return this;
        }

        ClassifiedLine classified = classifier.classify(rawLine);
        if (classified instanceof ClassifiedLine.Header header) {
            catalogId = header.catalogId();
            title = header.title();
        } else if (classified instanceof ClassifiedLine.Language languageLine) {
            language = languageLine.language();
        } else if (classified instanceof ClassifiedLine.ObjectType objectTypeLine) {
            objectType = objectTypeLine.objectType();
        } else if (classified instanceof ClassifiedLine.Surface surface) {
            onSurface(surface);
        } else if (classified instanceof ClassifiedLine.Column column) {
            onColumn(column);
        } else if (classified instanceof ClassifiedLine.State state) {
            onState(state);
        } else if (classified instanceof ClassifiedLine.Content content) {
            onContent(content);
        } else if (classified instanceof ClassifiedLine.Composite composite) {
            onComposite(composite.ref());
        } else if (classified instanceof ClassifiedLine.Translation translation) {
            onTranslation(translation);
        } else if (classified instanceof ClassifiedLine.Comment comment) {
            logger.debug("跳过注释行: #{}", comment.text());
        } else if (classified instanceof ClassifiedLine.Unknown unknown) {
            logger.debug("无法识别的行已丢弃: {}", unknown.raw());
        }
        return this;
    }

    /**
     * 冻结草稿并生成不可变文档。
     */
    public Document build() {
        built = true;
        List<Surface> frozenSurfaces = new ArrayList<>(surfaces.size());
        for (SurfaceDraft draft : surfaces) {
            frozenSurfaces.add(draft.freeze());
        }

        Document document = new Document(
            new Header(catalogId, title, language, objectType),
            frozenSurfaces,
            compositeRefs,
            frozenSurfaces.size() > 1,
            Document.computeMultipleColumns(frozenSurfaces)
        );
        logger.debug("解析完成: catalogId={}, surfaces={}, compositeRefs={}",
            catalogId, frozenSurfaces.size(), compositeRefs.size());
        return document;
    }

    private void onSurface(ClassifiedLine.Surface surface) {
        // 内容先于 @obverse 出现时，复用已自动创建的默认表面，名称以声明为准
        if (isObverse(surface.name(), surface.modifier()) && surfaces.size() == 1) {
            SurfaceDraft existing = surfaces.get(0);
            if (existing.autoCreated || isObverse(existing.name, existing.modifier)) {
                existing.name = surface.name();
                currentSurface = 0;
                currentColumn = null;
                return;
            }
        }
        currentSurface = addSurface(surface.name(), surface.modifier());
        currentColumn = null;
    }

    private void onColumn(ClassifiedLine.Column column) {
        SurfaceDraft surface = ensureSurface();
        surface.columns.add(new ColumnDraft(column.number(), false));
        currentColumn = surface.columns.size() - 1;
    }

    private void onState(ClassifiedLine.State state) {
        SurfaceDraft surface = ensureSurface();
        Line.StateLine stateLine = new Line.StateLine(state.text());
        if (currentColumn != null) {
            surface.columns.get(currentColumn).lines.add(stateLine);
        } else {
            surface.states.add(stateLine);
        }
    }

    private void onContent(ClassifiedLine.Content content) {
        SurfaceDraft surface = ensureSurface();
        Line.ContentLine line = new Line.ContentLine(
            content.number(), content.prime(), content.raw(), tokenizer.tokenize(content.raw()));

        if (currentColumn != null) {
            surface.columns.get(currentColumn).lines.add(line);
            return;
        }
        if (surface.columns.isEmpty()) {
            surface.columns.add(new ColumnDraft(Constants.IMPLICIT_COLUMN_NUMBER, true));
        }
        surface.columns.get(surface.columns.size() - 1).lines.add(line);
    }

    private void onComposite(CompositeRef ref) {
        if (currentSurface == null) {
            logger.debug("复合文本引用出现在任何表面之前，已忽略: {}", ref);
            return;
        }
        compositeRefs.add(ref);

        ColumnDraft column = activeColumn();
        if (column == null || column.lines.isEmpty()) {
            return;
        }
        int lastIndex = column.lines.size() - 1;
        if (column.lines.get(lastIndex) instanceof Line.ContentLine contentLine) {
            column.lines.set(lastIndex, contentLine.withComposite(ref));
        }
    }

    private void onTranslation(ClassifiedLine.Translation translation) {
        if (currentSurface == null) {
            logger.debug("行内译文出现在任何表面之前，已忽略: {}", translation.text());
            return;
        }
        ColumnDraft column = activeColumn();
        if (column == null) {
            return;
        }
        for (int index = column.lines.size() - 1; index >= 0; index--) {
            if (column.lines.get(index) instanceof Line.ContentLine contentLine) {
                column.lines.set(index, contentLine.withTranslation(translation.language(), translation.text()));
                return;
            }
        }
        logger.debug("行内译文没有可附着的内容行: {}", translation.text());
    }

    /**
     * 当前栏；未显式声明栏时退回当前表面的最后一栏。
     */
    private ColumnDraft activeColumn() {
        SurfaceDraft surface = surfaces.get(currentSurface);
        if (currentColumn != null) {
            return surface.columns.get(currentColumn);
        }
        if (surface.columns.isEmpty()) {
            return null;
        }
        return surface.columns.get(surface.columns.size() - 1);
    }

    private SurfaceDraft ensureSurface() {
        if (currentSurface == null) {
            currentSurface = addSurface(defaultSurfaceName, null);
            surfaces.get(currentSurface).autoCreated = true;
            currentColumn = null;
        }
        return surfaces.get(currentSurface);
    }

    private int addSurface(String name, String modifier) {
        surfaces.add(new SurfaceDraft(name, modifier));
        return surfaces.size() - 1;
    }

    private static boolean isObverse(String name, String modifier) {
        return Constants.DEFAULT_SURFACE_NAME.equals(name) && modifier == null;
    }

    private static final class SurfaceDraft {
        private String name;
        private final String modifier;
        private boolean autoCreated;
        private final List<ColumnDraft> columns = new ArrayList<>();
        private final List<Line.StateLine> states = new ArrayList<>();

        private SurfaceDraft(String name, String modifier) {
            this.name = name;
            this.modifier = modifier;
        }

        private Surface freeze() {
            List<Column> frozenColumns = new ArrayList<>(columns.size());
            for (ColumnDraft column : columns) {
                frozenColumns.add(new Column(column.number, column.implicit, column.lines));
            }
            return new Surface(name, Surface.labelFor(name, modifier), modifier, frozenColumns, states);
        }
    }

    private static final class ColumnDraft {
        private final int number;
        private final boolean implicit;
        private final List<Line> lines = new ArrayList<>();

        private ColumnDraft(int number, boolean implicit) {
            this.number = number;
            this.implicit = implicit;
        }
    }
}
