package forecast;

import forecast.data.DataTable;

import java.time.LocalDate;

/** Built-in demo data: four years of monthly revenue with a yearly cycle. */
final class SampleData {

    static final String DATE_COLUMN = "Date";
    static final String TARGET_COLUMN = "Revenue";

    private SampleData() {
    }

    static DataTable monthlyRevenue() {
        double[] revenue = monthlyRevenueValues();
        DataTable.Builder b = DataTable.builder(DATE_COLUMN, TARGET_COLUMN);
        LocalDate start = LocalDate.of(2021, 1, 1);
        for (int i = 0; i < revenue.length; i++) {
            b.row(start.plusMonths(i).toString(), revenue[i]);
        }
        return b.build();
    }

    /** Monthly store revenue in thousands: year-end peak, early-year dip, steady growth. */
    static double[] monthlyRevenueValues() {
        return new double[] {
            1312, 1262, 1425, 1445, 1519, 1493, 1434, 1484, 1510, 1577, 1736, 1911,
            1329, 1321, 1474, 1508, 1581, 1536, 1500, 1520, 1588, 1642, 1803, 1985,
            1382, 1369, 1513, 1575, 1620, 1612, 1557, 1571, 1640, 1676, 1890, 2063,
            1440, 1393, 1585, 1633, 1672, 1662, 1583, 1642, 1695, 1745, 1966, 2131
        };
    }
}
