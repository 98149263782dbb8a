package org.sfgen.context;

import org.sfgen.ir.CallTrees;
import org.sfgen.ir.DeferredNode;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.extraction.FieldExtraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the declarations of one generated source file in registration order.
 * <p>
 * Function, class and kernel namespace names must be unique within a file.
 * A context is an explicit builder value: it is created per file and passed to
 * whoever composes the file's contents.
 */
public class SourceFileContext {

    private final String outerNamespace;
    private final String defaultKernelNamespace;
    private final boolean castIndexingSymbols;
    private final List<Declaration> declarations = new ArrayList<>();
    private final Set<HeaderInclude> includes = new HashSet<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final Map<String, CppClass> classes = new LinkedHashMap<>();
    private final Map<String, KernelNamespace> kernelNamespaces = new LinkedHashMap<>();
    private String prelude = "";

    public SourceFileContext() {
        this("", "kernels");
    }

    public SourceFileContext(String outerNamespace, String defaultKernelNamespace) {
        this(outerNamespace, defaultKernelNamespace, true);
    }

    /**
     * @param outerNamespace The namespace enclosing all generated code, empty for the global namespace.
     * @param defaultKernelNamespace Name of the kernel namespace returned by {@link #kernels()}.
     * @param castIndexingSymbols Whether field mappings created by {@link #mapField} cast extents and strides.
     */
    public SourceFileContext(String outerNamespace, String defaultKernelNamespace, boolean castIndexingSymbols) {
        this.outerNamespace = outerNamespace == null ? "" : outerNamespace;
        this.defaultKernelNamespace = defaultKernelNamespace;
        this.castIndexingSymbols = castIndexingSymbols;
    }

    public boolean castIndexingSymbols() {
        return castIndexingSymbols;
    }

    /**
     * Maps a field onto a data structure, casting indexing symbols as configured for this file.
     *
     * @param field The field to map.
     * @param extraction The data structure to extract field properties from.
     * @return The deferred field mapping node.
     */
    public DeferredNode mapField(FieldDescription field, FieldExtraction extraction) {
        return CallTrees.mapField(field, extraction, castIndexingSymbols);
    }

    public String outerNamespace() {
        return outerNamespace;
    }

    public String prelude() {
        return prelude;
    }

    /**
     * Appends a line to the prelude comment.
     *
     * @param text The comment text.
     * @return This context.
     */
    public SourceFileContext appendPrelude(String text) {
        prelude = prelude.isEmpty() ? text : prelude + "\n" + text;
        return this;
    }

    /**
     * Registers an include. Registering the same include twice has no effect.
     *
     * @param header Header in {@code <sys>}, {@code "proj"} or plain form.
     * @param privateInclude Whether the include is only needed by the implementation file.
     * @return This context.
     */
    public SourceFileContext include(String header, boolean privateInclude) {
        return include(HeaderFile.parse(header), privateInclude);
    }

    public SourceFileContext include(HeaderFile header, boolean privateInclude) {
        HeaderInclude incl = new HeaderInclude(header, privateInclude);
        if (includes.add(incl)) {
            declarations.add(incl);
        }
        return this;
    }

    public SourceFileContext include(String header) {
        return include(header, false);
    }

    public SourceFileContext define(String code) {
        declarations.add(new CustomDefinition(code));
        return this;
    }

    /**
     * @return The default kernel namespace, created on first access.
     */
    public KernelNamespace kernels() {
        return kernelNamespace(defaultKernelNamespace);
    }

    /**
     * Returns the kernel namespace of the given name, creating and registering it if necessary.
     *
     * @param name The namespace name.
     * @return The kernel namespace.
     * @throws SfgException if a function or class of that name exists.
     */
    public KernelNamespace kernelNamespace(String name) {
        KernelNamespace kns = kernelNamespaces.get(name);
        if (kns == null) {
            checkUnique(name);
            kns = new KernelNamespace(name, outerNamespace);
            kernelNamespaces.put(name, kns);
            declarations.add(kns);
        }
        return kns;
    }

    /**
     * @param function The function to register.
     * @return This context.
     * @throws SfgException if the name is already taken.
     */
    public SourceFileContext add(Function function) {
        checkUnique(function.name());
        functions.put(function.name(), function);
        declarations.add(function);
        return this;
    }

    /**
     * @param cls The class to register.
     * @return This context.
     * @throws SfgException if the name is already taken.
     */
    public SourceFileContext add(CppClass cls) {
        checkUnique(cls.name());
        classes.put(cls.name(), cls);
        declarations.add(cls);
        return this;
    }

    private void checkUnique(String name) {
        if (functions.containsKey(name)) {
            throw new SfgException("Duplicate function: " + name);
        }
        if (classes.containsKey(name)) {
            throw new SfgException("Duplicate class: " + name);
        }
        if (kernelNamespaces.containsKey(name)) {
            throw new SfgException("Duplicate kernel namespace: " + name);
        }
    }

    public Optional<Function> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<CppClass> cppClass(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    /**
     * @return All declarations in registration order.
     */
    public List<Declaration> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public List<HeaderInclude> includes() {
        return declarations.stream().filter(HeaderInclude.class::isInstance).map(HeaderInclude.class::cast).toList();
    }

    public List<Function> functions() {
        return List.copyOf(functions.values());
    }

    public List<CppClass> classes() {
        return List.copyOf(classes.values());
    }

    public List<KernelNamespace> kernelNamespaces() {
        return List.copyOf(kernelNamespaces.values());
    }
}
