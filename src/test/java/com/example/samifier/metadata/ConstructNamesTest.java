package com.example.samifier.metadata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConstructNamesTest {

    @Test
    public void testResourceLeafIsDropped() {
        assertEquals("OrdersTable", ConstructNames.candidateFor("/Orders/OrdersTable/Resource"));
        assertEquals("Handler", ConstructNames.candidateFor("/Orders/Handler/Resource"));
    }

    @Test
    public void testServiceRoleNames() {
        assertEquals("HandlerRole", ConstructNames.candidateFor("/Orders/Handler/ServiceRole/Resource"));
        assertEquals("HandlerPolicy", ConstructNames.candidateFor("/Orders/Handler/ServiceRole/DefaultPolicy/Resource"));
    }

    @Test
    public void testDeepPathsKeepRootParentAndLeaf() {
        assertEquals("VpcPublicSubnet1RouteTable", ConstructNames.candidateFor("/Orders/Vpc/PublicSubnet1/RouteTable"));
        assertEquals("ApiordersGET", ConstructNames.candidateFor("/Orders/Api/Default/v1/orders/GET/Resource"));
    }

    @Test
    public void testDefaultSegmentsAreDropped() {
        assertEquals("CDKMetadata", ConstructNames.candidateFor("/Orders/CDKMetadata/Default"));
        assertEquals("Default", ConstructNames.candidateFor("/Orders/Default/Default"));
    }

    @Test
    public void testSanitizeAndHash() {
        assertEquals("orderstable", ConstructNames.sanitize("orders-table"));
        assertEquals("Resource1Bucket", ConstructNames.sanitize("1Bucket"));
        assertEquals("Resource", ConstructNames.sanitize("--"));
        assertEquals("OrdersTable", ConstructNames.stripHash("OrdersTable0A1B2C3D"));
        assertEquals("0A1B2C3D", ConstructNames.stripHash("0A1B2C3D"));
        assertEquals("Bucketabcdef12", ConstructNames.stripHash("Bucketabcdef12"));
    }

    @Test
    public void testLogGroupRule() {
        assertEquals("HandlerLogs", ConstructNames.candidateFor("/Orders/HandlerLogGroup/Resource"));
    }

    @Test
    public void testTypeSuffix() {
        assertEquals("Table", ConstructNames.typeSuffix("AWS::DynamoDB::Table"));
        assertEquals("Resource", ConstructNames.typeSuffix(null));
        assertEquals("Custom", ConstructNames.typeSuffix("Custom"));
    }
}
