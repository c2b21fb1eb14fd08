// This file is part of PipeQL.
// Copyright (C) 2018-2020  The PipeQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pipeql.functions;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.PlanException;
import net.pipeql.execute.Aggregates;
import net.pipeql.execute.TransformationRegistry;
import net.pipeql.plan.BoundsSpec;
import net.pipeql.plan.CreateProcedureSpec;
import net.pipeql.plan.PlanAdministration;
import net.pipeql.plan.ProcedureID;
import net.pipeql.plan.ProcedureRegistry;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.query.Administration;
import net.pipeql.query.BuiltinRegistry;
import net.pipeql.query.CreateOperationSpec;
import net.pipeql.query.OperationSpec;
import net.pipeql.query.QueryArguments;
import net.pipeql.query.TableObject;
import net.pipeql.semantic.ArrayType;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.semantic.Kind;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;

/**
 * Registers the builtin operations with the compile, plan and execute
 * registries.
 * 
 * @since 1.0
 */
public final class BuiltinFunctions {
  private static final Type STRINGS = new ArrayType(Types.STRING);
  
  /** Mean of the piped table since a relative start. */
  public static final String MEAN_SINCE = 
      "meanSince = (table=<-, start) => table |> range(start: start) "
      + "|> mean()";
  
  private BuiltinFunctions() { }
  
  /**
   * @param builtins The open builtin registry.
   * @param procedures The open procedure registry.
   * @param transformations The open transformation registry.
   * @throws net.pipeql.exceptions.RegistryException if any of them is 
   * frozen or an operation is already registered.
   */
  public static void register(final BuiltinRegistry builtins, 
                              final ProcedureRegistry procedures, 
                              final TransformationRegistry transformations) {
    registerFrom(builtins, procedures, transformations);
    registerRange(builtins, procedures, transformations);
    registerFilter(builtins, procedures, transformations);
    registerAggregate(MeanOpSpec.KIND, Aggregates.MEAN, MeanOpSpec.class, 
        builtins, procedures, transformations);
    registerAggregate(CountOpSpec.KIND, Aggregates.COUNT, CountOpSpec.class,
        builtins, procedures, transformations);
    registerAggregate(SumOpSpec.KIND, Aggregates.SUM, SumOpSpec.class, 
        builtins, procedures, transformations);
    registerPivot(builtins, procedures, transformations);
    registerSchemaMutations(builtins, procedures, transformations);
    registerJoin(builtins, procedures, transformations);
    registerYield(builtins, procedures, transformations);
    builtins.registerBuiltIn("meanSince", MEAN_SINCE);
  }
  
  private static void registerFrom(final BuiltinRegistry builtins, 
                                   final ProcedureRegistry procedures, 
                                   final TransformationRegistry transformations) {
    builtins.registerFunction(FromOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        return new FromOpSpec(args.getRequiredString("bucket"));
      }
    }, FunctionSignature.newBuilder()
        .addParam("bucket", Types.STRING)
        .setReturnType(Types.TABLE)
        .build());
    builtins.registerOperationSpec(FromOpSpec.KIND, FromOpSpec.class);
    procedures.registerProcedureSpec(FromOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            return new FromProcedureSpec(
                ((FromOpSpec) check(spec, FromOpSpec.class)).bucket());
          }
        }, FromOpSpec.KIND);
    transformations.registerSource(FromOpSpec.KIND, new FromSource.Create());
  }
  
  private static void registerRange(final BuiltinRegistry builtins, 
                                    final ProcedureRegistry procedures, 
                                    final TransformationRegistry transformations) {
    builtins.registerFunction(RangeOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new RangeOpSpec(args.getRequiredTime("start"), 
            args.getTime("stop"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("start", Types.ANY)
        .addParam("stop", Types.ANY)
        .build());
    builtins.registerOperationSpec(RangeOpSpec.KIND, RangeOpSpec.class);
    procedures.registerProcedureSpec(RangeOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            final RangeOpSpec range = 
                (RangeOpSpec) check(spec, RangeOpSpec.class);
            return new RangeProcedureSpec(new BoundsSpec(
                range.start(), range.stop()));
          }
        }, RangeOpSpec.KIND);
    transformations.registerTransformation(RangeOpSpec.KIND, 
        new RangeTransformation.Create());
  }
  
  private static void registerFilter(final BuiltinRegistry builtins, 
                                     final ProcedureRegistry procedures, 
                                     final TransformationRegistry transformations) {
    builtins.registerFunction(FilterOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new FilterOpSpec(args.getRequiredFunction("fn"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("fn", Types.ANY)
        .build());
    builtins.registerOperationSpec(FilterOpSpec.KIND, FilterOpSpec.class);
    procedures.registerProcedureSpec(FilterOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            return new FilterProcedureSpec(
                ((FilterOpSpec) check(spec, FilterOpSpec.class)).fn());
          }
        }, FilterOpSpec.KIND);
    transformations.registerTransformation(FilterOpSpec.KIND, 
        new FilterTransformation.Create());
  }
  
  private static void registerAggregate(final String kind, 
      final Aggregates aggregate, 
      final Class<? extends AggregateOpSpec> clazz, 
      final BuiltinRegistry builtins, 
      final ProcedureRegistry procedures, 
      final TransformationRegistry transformations) {
    builtins.registerFunction(kind, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        final List<String> columns = args.getStrings("columns");
        switch (aggregate) {
        case COUNT:
          return new CountOpSpec(columns);
        case SUM:
          return new SumOpSpec(columns);
        default:
          return new MeanOpSpec(columns);
        }
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("columns", STRINGS)
        .build());
    builtins.registerOperationSpec(kind, clazz);
    procedures.registerProcedureSpec(kind, new CreateProcedureSpec() {
      @Override
      public ProcedureSpec create(final OperationSpec spec, 
                                  final PlanAdministration administration) {
        return new SimpleAggregateProcedureSpec(kind, aggregate, 
            ((AggregateOpSpec) check(spec, clazz)).columns());
      }
    }, kind);
    transformations.registerTransformation(kind, 
        new AggregateTransformation.Create());
  }
  
  private static void registerPivot(final BuiltinRegistry builtins, 
                                    final ProcedureRegistry procedures, 
                                    final TransformationRegistry transformations) {
    builtins.registerFunction(PivotOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new PivotOpSpec(required(args, "rowKey"), 
            required(args, "colKey"), 
            args.getRequiredString("valueCol"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("rowKey", STRINGS)
        .addParam("colKey", STRINGS)
        .addParam("valueCol", Types.STRING)
        .build());
    builtins.registerOperationSpec(PivotOpSpec.KIND, PivotOpSpec.class);
    procedures.registerProcedureSpec(PivotOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            final PivotOpSpec pivot = 
                (PivotOpSpec) check(spec, PivotOpSpec.class);
            return new PivotProcedureSpec(pivot.rowKey(), pivot.colKey(), 
                pivot.valueCol());
          }
        }, PivotOpSpec.KIND);
    transformations.registerTransformation(PivotOpSpec.KIND, 
        new PivotTransformation.Create());
  }
  
  private static void registerSchemaMutations(
      final BuiltinRegistry builtins, 
      final ProcedureRegistry procedures, 
      final TransformationRegistry transformations) {
    builtins.registerFunction(RenameOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        Map<String, String> columns = null;
        final ObjectValue object = args.getObject("columns");
        if (object != null) {
          columns = Maps.newLinkedHashMap();
          for (final String key : object.keys()) {
            final Value v = object.get(key);
            if (v.type().kind() != Kind.STRING) {
              throw new CompileException("rename columns must map to "
                  + "strings, got " + v.type() + " for \"" + key + "\"");
            }
            columns.put(key, v.str());
          }
        }
        return new RenameOpSpec(columns, args.getFunction("fn"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("columns", Types.EMPTY_OBJECT)
        .addParam("fn", Types.ANY)
        .build());
    builtins.registerOperationSpec(RenameOpSpec.KIND, RenameOpSpec.class);
    
    builtins.registerFunction(DropOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new DropOpSpec(args.getStrings("columns"), 
            args.getFunction("fn"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("columns", STRINGS)
        .addParam("fn", Types.ANY)
        .build());
    builtins.registerOperationSpec(DropOpSpec.KIND, DropOpSpec.class);
    
    builtins.registerFunction(KeepOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new KeepOpSpec(args.getStrings("columns"), 
            args.getFunction("fn"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("columns", STRINGS)
        .addParam("fn", Types.ANY)
        .build());
    builtins.registerOperationSpec(KeepOpSpec.KIND, KeepOpSpec.class);
    
    builtins.registerFunction(DuplicateOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        administration.addParentFromArgs(true);
        return new DuplicateOpSpec(args.getRequiredString("column"), 
            args.getRequiredString("as"));
      }
    }, FunctionSignature.newTransformationBuilder()
        .addParam("column", Types.STRING)
        .addParam("as", Types.STRING)
        .build());
    builtins.registerOperationSpec(DuplicateOpSpec.KIND, 
        DuplicateOpSpec.class);
    
    procedures.registerProcedureSpec(SchemaMutationProcedureSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            return new SchemaMutationProcedureSpec(Lists.newArrayList(
                (SchemaMutation) check(spec, SchemaMutation.class)));
          }
        }, RenameOpSpec.KIND, DropOpSpec.KIND, KeepOpSpec.KIND, 
        DuplicateOpSpec.KIND);
    transformations.registerTransformation(SchemaMutationProcedureSpec.KIND, 
        new SchemaMutationTransformation.Create());
  }
  
  private static void registerJoin(final BuiltinRegistry builtins, 
                                   final ProcedureRegistry procedures, 
                                   final TransformationRegistry transformations) {
    builtins.registerFunction(JoinOpSpec.KIND, new CreateOperationSpec() {
      @Override
      public OperationSpec create(final QueryArguments args, 
                                  final Administration administration) {
        final ObjectValue object = args.getRequiredObject("tables");
        final Map<String, TableObject> tables = Maps.newTreeMap();
        for (final String name : object.keys()) {
          final Value v = object.get(name);
          if (!(v instanceof TableObject)) {
            throw new CompileException("join tables must be table objects, "
                + "got " + v.type() + " for \"" + name + "\"");
          }
          tables.put(name, (TableObject) v);
        }
        for (final TableObject table : tables.values()) {
          administration.addParent(table);
        }
        return new JoinOpSpec(tables, args.getStrings("on"));
      }
    }, FunctionSignature.newBuilder()
        .addParam("tables", Types.EMPTY_OBJECT)
        .addParam("on", STRINGS)
        .setReturnType(Types.TABLE)
        .build());
    builtins.registerOperationSpec(JoinOpSpec.KIND, JoinOpSpec.class);
    procedures.registerProcedureSpec(JoinOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            final JoinOpSpec join = (JoinOpSpec) check(spec, JoinOpSpec.class);
            final Map<ProcedureID, String> names = Maps.newLinkedHashMap();
            for (final Map.Entry<String, String> entry : 
                join.tableNames().entrySet()) {
              names.put(administration.convertID(entry.getKey()), 
                  entry.getValue());
            }
            return new MergeJoinProcedureSpec(join.on(), names);
          }
        }, JoinOpSpec.KIND);
    transformations.registerTransformation(JoinOpSpec.KIND, 
        new MergeJoinTransformation.Create());
  }
  
  private static void registerYield(final BuiltinRegistry builtins, 
                                    final ProcedureRegistry procedures, 
                                    final TransformationRegistry transformations) {
    builtins.registerFunctionWithSideEffect(YieldOpSpec.KIND, 
        new CreateOperationSpec() {
          @Override
          public OperationSpec create(final QueryArguments args, 
                                      final Administration administration) {
            administration.addParentFromArgs(true);
            return new YieldOpSpec(args.getString("name"));
          }
        }, FunctionSignature.newTransformationBuilder()
            .addParam("name", Types.STRING)
            .build());
    builtins.registerOperationSpec(YieldOpSpec.KIND, YieldOpSpec.class);
    procedures.registerProcedureSpec(YieldOpSpec.KIND, 
        new CreateProcedureSpec() {
          @Override
          public ProcedureSpec create(final OperationSpec spec, 
                                      final PlanAdministration administration) {
            return new NamedYieldProcedureSpec(
                ((YieldOpSpec) check(spec, YieldOpSpec.class)).name());
          }
        }, YieldOpSpec.KIND);
    transformations.registerTransformation(YieldOpSpec.KIND, 
        new YieldTransformation.Create());
  }
  
  private static List<String> required(final QueryArguments args, 
                                       final String name) {
    args.getRequiredArray(name);
    return args.getStrings(name);
  }
  
  private static OperationSpec check(final OperationSpec spec, 
                                     final Class<?> clazz) {
    if (!clazz.isInstance(spec)) {
      throw new PlanException("invalid spec type " 
          + spec.getClass().getName() + " for " + spec.kind());
    }
    return spec;
  }
}
