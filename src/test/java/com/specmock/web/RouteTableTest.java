package com.specmock.web;

import com.specmock.exception.ContractLoadException;
import com.specmock.model.MockContract;
import com.specmock.model.MockOperation;
import com.specmock.model.PathDefinition;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RouteTableTest {

    private static MockOperation op(HttpMethod method, String path, String id) {
        return MockOperation.builder().method(method).path(path).operationId(id).build();
    }

    private static PathDefinition path(MockOperation... operations) {
        Map<HttpMethod, MockOperation> byMethod = new LinkedHashMap<>();
        for (MockOperation operation : operations) {
            byMethod.put(operation.method(), operation);
        }
        return new PathDefinition(byMethod);
    }

    @Test
    void from_createsOneRoutePerMethodAndPath() {
        Map<String, PathDefinition> paths = new LinkedHashMap<>();
        paths.put("/pets", path(op(HttpMethod.GET, "/pets", "listPets"), op(HttpMethod.POST, "/pets", "createPet")));
        paths.put("/pets/{petId}", path(op(HttpMethod.GET, "/pets/{petId}", "getPet")));

        RouteTable table = RouteTable.from(new MockContract(paths, Map.of()));

        assertThat(table.size()).isEqualTo(3);
        assertThat(table.routes())
                .extracting(RouteTable.Route::method, RouteTable.Route::path, route -> route.operation().operationId())
                .containsExactlyInAnyOrder(
                        tuple(HttpMethod.GET, "/pets", "listPets"),
                        tuple(HttpMethod.POST, "/pets", "createPet"),
                        tuple(HttpMethod.GET, "/pets/{petId}", "getPet"));
    }

    @Test
    void from_ordersLiteralPathsBeforeTemplatedSiblings() {
        Map<String, PathDefinition> paths = new LinkedHashMap<>();
        paths.put("/pets/{petId}", path(op(HttpMethod.GET, "/pets/{petId}", "getPet")));
        paths.put("/pets/search", path(op(HttpMethod.GET, "/pets/search", "searchPets")));

        RouteTable table = RouteTable.from(new MockContract(paths, Map.of()));

        assertThat(table.routes()).extracting(RouteTable.Route::path).containsExactly("/pets/search", "/pets/{petId}");
    }

    @Test
    void from_ordersHeadBeforeGetOnTheSamePath() {
        Map<String, PathDefinition> paths = new LinkedHashMap<>();
        paths.put("/pets", path(op(HttpMethod.GET, "/pets", "listPets"), op(HttpMethod.HEAD, "/pets", "headPets")));

        RouteTable table = RouteTable.from(new MockContract(paths, Map.of()));

        assertThat(table.routes()).extracting(RouteTable.Route::method).containsExactly(HttpMethod.HEAD, HttpMethod.GET);
    }

    @Test
    void from_rejectsContractWithoutOperations() {
        Map<String, PathDefinition> paths = Map.of("/empty", new PathDefinition(Map.of()));

        assertThatThrownBy(() -> RouteTable.from(new MockContract(paths, Map.of())))
                .isInstanceOf(ContractLoadException.class);
    }

    @Test
    void routes_cannotBeModified() {
        RouteTable table = RouteTable.from(new MockContract(
                Map.of("/pets", path(op(HttpMethod.GET, "/pets", "listPets"))), Map.of()));

        assertThatThrownBy(() -> table.routes().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
