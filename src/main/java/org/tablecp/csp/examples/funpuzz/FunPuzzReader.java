/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.tablecp.util.exception.InvalidModelException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads FunPuzz instances written in JSON, in one of two forms.
 * <p>
 * Object form, with 0-based cells:
 * <pre>
 * {"size": 3, "cages": [{"cells": [[0,0],[0,1]], "target": 3, "op": "+"}, ...]}
 * </pre>
 * List form, where the first entry is the size, a cell is written as the
 * number {@code <row><col>} (1-based), and a cage lists its cells followed by
 * the target and an operation code (0 add, 1 subtract, 2 divide, 3 multiply).
 * A cage with only a cell and a target fixes that cell:
 * <pre>
 * [[3], [11, 12, 3, 0], [13, 2], ...]
 * </pre>
 */
public final class FunPuzzReader {

    private FunPuzzReader() {
    }

    public static FunPuzz read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @param json an instance in object or list form
     * @return the instance
     * @throws InvalidModelException if the text is not a valid instance
     */
    public static FunPuzz parse(String json) {
        try {
            Object root = new JSONTokener(json).nextValue();
            if (root instanceof JSONObject) {
                return parseObject((JSONObject) root);
            } else if (root instanceof JSONArray) {
                return parseList((JSONArray) root);
            }
            throw new InvalidModelException("a FunPuzz instance must be a JSON object or array");
        } catch (JSONException e) {
            throw new InvalidModelException("malformed FunPuzz instance: " + e.getMessage(), e);
        }
    }

    private static FunPuzz parseObject(JSONObject root) {
        int size = root.getInt("size");
        List<Cage> cages = new ArrayList<>();
        JSONArray jsonCages = root.optJSONArray("cages");
        if (jsonCages != null) {
            for (int i = 0; i < jsonCages.length(); i++) {
                JSONObject jsonCage = jsonCages.getJSONObject(i);
                JSONArray jsonCells = jsonCage.getJSONArray("cells");
                List<Cell> cells = new ArrayList<>();
                for (int j = 0; j < jsonCells.length(); j++) {
                    JSONArray cell = jsonCells.getJSONArray(j);
                    cells.add(new Cell(cell.getInt(0), cell.getInt(1)));
                }
                int target = jsonCage.getInt("target");
                CageOperation op = cells.size() == 1 && !jsonCage.has("op")
                        ? CageOperation.ADD
                        : CageOperation.fromSymbol(jsonCage.getString("op"));
                cages.add(new Cage(cells, target, op));
            }
        }
        return new FunPuzz(size, cages);
    }

    private static FunPuzz parseList(JSONArray root) {
        if (root.isEmpty()) {
            throw new InvalidModelException("empty FunPuzz instance");
        }
        int size = root.getJSONArray(0).getInt(0);
        List<Cage> cages = new ArrayList<>();
        for (int i = 1; i < root.length(); i++) {
            JSONArray entry = root.getJSONArray(i);
            if (entry.length() == 2) {
                cages.add(Cage.single(decodeCell(entry.getInt(0)), entry.getInt(1)));
            } else if (entry.length() >= 3) {
                List<Cell> cells = new ArrayList<>();
                for (int j = 0; j < entry.length() - 2; j++) {
                    cells.add(decodeCell(entry.getInt(j)));
                }
                int target = entry.getInt(entry.length() - 2);
                CageOperation op = CageOperation.fromCode(entry.getInt(entry.length() - 1));
                cages.add(new Cage(cells, target, op));
            } else {
                throw new InvalidModelException("cage " + entry + " must have one cell and a target, or cells, a target and an operation");
            }
        }
        return new FunPuzz(size, cages);
    }

    private static Cell decodeCell(int code) {
        return new Cell(code / 10 - 1, code % 10 - 1);
    }
}
