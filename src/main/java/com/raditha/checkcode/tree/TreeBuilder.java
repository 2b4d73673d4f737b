package com.raditha.checkcode.tree;

import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.ReportNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles analysed files into a directory tree.
 * <p>
 * The result always has a synthetic top directory named {@value #ROOT_NAME};
 * below it every path component of every file's parent directory gets exactly
 * one node, created the first time a file under it is seen. Children keep
 * encounter order. Use {@link TreePruner} afterwards to strip the outer
 * directories that hold nothing but a single sub-directory.
 */
public class TreeBuilder {

    public static final String ROOT_NAME = "root";

    private final String rootPath;

    /**
     * Create builder whose synthetic root points at the working directory.
     */
    public TreeBuilder() {
        this(Path.of("").toAbsolutePath().toString());
    }

    /**
     * @param rootPath Path reported for the synthetic root
     */
    public TreeBuilder(String rootPath) {
        this.rootPath = rootPath;
    }

    /**
     * Build the tree for a list of file nodes.
     *
     * @param files Analysed files, in the order they should appear
     * @return The synthetic root directory
     */
    public DirectoryNode build(List<FileNode> files) {
        DirectoryBuilder root = new DirectoryBuilder(ROOT_NAME, rootPath);
        // arena of directory nodes for this call, keyed by absolute path
        Map<String, DirectoryBuilder> lookup = new HashMap<>();
        lookup.put("", root);

        for (FileNode file : files) {
            Path parentPath = Path.of(file.path()).toAbsolutePath().normalize().getParent();
            DirectoryBuilder parent = root;
            if (parentPath != null) {
                for (Path prefix : prefixes(parentPath)) {
                    String key = prefix.toString();
                    DirectoryBuilder node = lookup.get(key);
                    if (node == null) {
                        node = new DirectoryBuilder(nameOf(prefix), key);
                        lookup.put(key, node);
                        parent.children.add(node);
                    }
                    parent = node;
                }
            }
            parent.children.add(file);
        }

        return root.build();
    }

    /**
     * Every ancestor of {@code directory} from the filesystem root down, including itself.
     */
    static List<Path> prefixes(Path directory) {
        List<Path> prefixes = new ArrayList<>();
        Path root = directory.getRoot();
        if (root != null) {
            prefixes.add(root);
        }
        for (int k = 1; k <= directory.getNameCount(); k++) {
            Path relative = directory.subpath(0, k);
            prefixes.add(root != null ? root.resolve(relative) : relative);
        }
        return prefixes;
    }

    private static String nameOf(Path prefix) {
        Path name = prefix.getFileName();
        return name != null ? name.toString() : prefix.toString();
    }

    /**
     * Mutable directory used while the tree is under construction.
     * Children are either {@link DirectoryBuilder}s or {@link FileNode}s.
     */
    private static final class DirectoryBuilder {
        private final String name;
        private final String path;
        private final List<Object> children = new ArrayList<>();

        DirectoryBuilder(String name, String path) {
            this.name = name;
            this.path = path;
        }

        DirectoryNode build() {
            List<ReportNode> built = new ArrayList<>(children.size());
            for (Object child : children) {
                built.add(child instanceof DirectoryBuilder dir ? dir.build() : (FileNode) child);
            }
            return new DirectoryNode(name, path, built);
        }
    }
}
